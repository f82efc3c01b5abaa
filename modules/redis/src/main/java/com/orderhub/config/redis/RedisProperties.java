package com.orderhub.config.redis;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Redis 접속 설정.
 * <p>
 * master 노드에는 스냅샷 쓰기가, replica 노드에는 일반 조회가 전달됩니다.
 * </p>
 *
 * @param database 데이터베이스 번호
 * @param master master 노드
 * @param replicas replica 노드 목록 (없으면 빈 목록)
 */
@ConfigurationProperties("redis")
public record RedisProperties(
    int database,
    RedisNodeInfo master,
    List<RedisNodeInfo> replicas
) {
    public RedisProperties {
        replicas = replicas == null ? List.of() : List.copyOf(replicas);
    }
}
