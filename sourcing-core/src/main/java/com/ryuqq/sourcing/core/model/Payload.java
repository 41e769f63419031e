package com.ryuqq.sourcing.core.model;

/**
 * 이벤트 본문, 커맨드 본문, 스냅샷 상태의 직렬화된 형태.
 *
 * <p>저장소와 큐는 Payload를 해석하지 않고 그대로 보관합니다. 본문의 형식은
 * {@code contentType}이 나타내며, 이를 만들고 읽는 쪽은
 * {@link com.ryuqq.sourcing.core.spi.PayloadCodec} 구현체입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>JSON: Payload.of("{\"productName\":\"Widget\",\"quantity\":2}")</li>
 *   <li>다른 형식: Payload.of("application/x-protobuf", base64Body)</li>
 *   <li>빈 본문: Payload.empty()</li>
 * </ul>
 *
 * @param contentType 본문 형식 (MIME 타입)
 * @param content 직렬화된 본문 (빈 문자열 허용)
 * @author Sourcing Team
 * @since 1.0.0
 */
public record Payload(String contentType, String content) {

    /**
     * 기본 본문 형식.
     */
    public static final String JSON = "application/json";

    public Payload {
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("contentType cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    /**
     * JSON 본문으로 Payload 생성.
     *
     * @param content JSON 본문
     * @return Payload 인스턴스
     * @throws IllegalArgumentException content가 null인 경우
     */
    public static Payload of(String content) {
        return new Payload(JSON, content);
    }

    /**
     * 형식을 지정해 Payload 생성.
     *
     * @param contentType 본문 형식
     * @param content 본문
     * @return Payload 인스턴스
     */
    public static Payload of(String contentType, String content) {
        return new Payload(contentType, content);
    }

    /**
     * 빈 JSON Payload 생성.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return new Payload(JSON, "");
    }

    /**
     * 본문이 비어있는지 확인 (공백만 있는 경우 포함).
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return content.isBlank();
    }

    /**
     * 형식 확인.
     *
     * @param expectedContentType 기대하는 형식
     * @return 형식이 같으면 true (대소문자 무시)
     */
    public boolean hasContentType(String expectedContentType) {
        return contentType.equalsIgnoreCase(expectedContentType);
    }

    // 본문은 길이만 노출
    @Override
    public String toString() {
        return "Payload{" + contentType + ", " + content.length() + " chars}";
    }
}
