package com.sessionretry.model.enums;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 后端状态码（封闭集合）
 * 未识别的数值统一映射为 UNKNOWN
 */
public enum StatusCode {

    UNDEFINED(0, StatusOrigin.NONE),
    UNKNOWN(-1, StatusOrigin.NONE),

    BAD_REQUEST(400010, StatusOrigin.OPERATION),
    UNAUTHORIZED(400020, StatusOrigin.OPERATION),
    INTERNAL_ERROR(400030, StatusOrigin.OPERATION),
    /** 事务因锁失效被回滚, 无副作用 */
    ABORTED(400040, StatusOrigin.OPERATION),
    UNAVAILABLE(400050, StatusOrigin.OPERATION),
    OVERLOADED(400060, StatusOrigin.OPERATION),
    SCHEME_ERROR(400070, StatusOrigin.OPERATION),
    GENERIC_ERROR(400080, StatusOrigin.OPERATION),
    TIMEOUT(400090, StatusOrigin.OPERATION),
    BAD_SESSION(400100, StatusOrigin.OPERATION),
    PRECONDITION_FAILED(400120, StatusOrigin.OPERATION),
    ALREADY_EXISTS(400130, StatusOrigin.OPERATION),
    NOT_FOUND(400140, StatusOrigin.OPERATION),
    SESSION_EXPIRED(400150, StatusOrigin.OPERATION),
    CANCELLED(400160, StatusOrigin.OPERATION),
    /** 提交与并发写冲突, 结果未知 */
    UNDETERMINED(400170, StatusOrigin.OPERATION),
    UNSUPPORTED(400180, StatusOrigin.OPERATION),
    SESSION_BUSY(400190, StatusOrigin.OPERATION),

    /** 请求发出前连接已断开 */
    TRANSPORT_UNAVAILABLE(401010, StatusOrigin.TRANSPORT),
    TRANSPORT_RESOURCE_EXHAUSTED(401020, StatusOrigin.TRANSPORT),
    /** 请求已发出, 等待响应时超时 */
    TRANSPORT_DEADLINE_EXCEEDED(401030, StatusOrigin.TRANSPORT),
    TRANSPORT_CANCELLED(401040, StatusOrigin.TRANSPORT),
    /** 流在传输中途被切断 */
    TRANSPORT_INTERNAL(401050, StatusOrigin.TRANSPORT),
    TRANSPORT_UNAUTHENTICATED(401060, StatusOrigin.TRANSPORT);

    private static final Map<Integer, StatusCode> BY_CODE = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(StatusCode::getCode, Function.identity()));

    private final int code;

    private final StatusOrigin origin;

    StatusCode(int code, StatusOrigin origin) {
        this.code = code;
        this.origin = origin;
    }

    public int getCode() {
        return code;
    }

    public StatusOrigin getOrigin() {
        return origin;
    }

    /**
     * 按数值解析, 不存在则返回 UNKNOWN
     */
    public static StatusCode fromCode(int code) {
        return BY_CODE.getOrDefault(code, UNKNOWN);
    }
}
