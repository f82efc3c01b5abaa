package com.orderhub.config.redis;

/**
 * Redis 노드 접속 정보.
 *
 * @param host 호스트
 * @param port 포트
 */
public record RedisNodeInfo(String host, int port) {
}
