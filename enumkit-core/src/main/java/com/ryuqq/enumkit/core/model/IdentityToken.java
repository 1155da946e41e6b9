package com.ryuqq.enumkit.core.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 인스턴스 동일성을 나타내는 불투명 토큰.
 *
 * <p>EnumItem과 Enumeration은 생성 시점에 토큰을 한 번 발급받으며,
 * 동등성 비교는 필드 값이 아니라 이 토큰으로만 수행합니다.
 * 필드가 모두 같더라도 따로 생성된 두 값은 서로 다른 토큰을 가집니다.</p>
 *
 * <p><strong>발급 규칙:</strong></p>
 * <ul>
 *   <li>공개 생성자 없음 ({@link #mint()}로만 발급)</li>
 *   <li>프로세스 전역 단조 증가 시퀀스 사용 (스레드 안전)</li>
 *   <li>복제(copy)는 새 토큰을 발급하지 않고 원본 토큰을 공유</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IdentityToken {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long sequence;

    private IdentityToken(long sequence) {
        this.sequence = sequence;
    }

    /**
     * 새 토큰 발급.
     *
     * @return 이전에 발급된 어떤 토큰과도 다른 토큰
     */
    public static IdentityToken mint() {
        return new IdentityToken(SEQUENCE.incrementAndGet());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdentityToken that = (IdentityToken) o;
        return sequence == that.sequence;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(sequence);
    }

    @Override
    public String toString() {
        return "Token{" + sequence + '}';
    }
}
