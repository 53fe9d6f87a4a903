package com.corvid.ir;

/**
 * 编译器内部不变量被破坏（上游 pass 的缺陷，而非用户程序的问题）。
 *
 * <p>不可恢复：降级过程遇到它即中止编译，消息总是带源码位置。</p>
 */
public class LoweringException extends RuntimeException {
    private final SourceLocation location;

    public LoweringException(String message, SourceLocation location) {
        super(message);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 不带位置的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at " + location;
    }
}
