package com.ryuqq.repoup.adapter.runner.lock;

import com.ryuqq.repoup.adapter.runner.json.RepoupJson;

import java.io.IOException;

/**
 * Lease JSON encoding ({@code {"acquiredAt":..,"expiresAt":..,"holderId":..,"repository":..}}).
 *
 * @author Repoup Team
 * @since 1.0.0
 */
final class LeaseCodec {

    private LeaseCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static byte[] encode(Lease lease) {
        try {
            return RepoupJson.mapper().writeValueAsBytes(lease);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode lease for " + lease.repository(), e);
        }
    }

    /**
     * Lease 디코딩.
     *
     * @param content lease 오브젝트 바이트
     * @return Lease
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    static Lease decode(byte[] content) {
        try {
            return RepoupJson.mapper().readValue(content, Lease.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed lease object: " + e.getMessage(), e);
        }
    }
}
