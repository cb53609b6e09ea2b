package com.ryuqq.repoup.core.error;

/**
 * 요청한 키에 오브젝트가 없는 경우.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class ObjectNotFoundException extends RepoupException {

    private final String key;

    public ObjectNotFoundException(String key) {
        super(ErrorCode.OBJECT_NOT_FOUND, "Object not found: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
