package com.corvid.ir.exec;

/**
 * 执行到运行时诊断陷阱（静态可证明不可达的代码实际被执行）。
 */
public class TrapException extends RuntimeException {

    private final long subject;

    public TrapException(String message, long subject) {
        super(message);
        this.subject = subject;
    }

    /** 陷阱携带的接收者/分派值 */
    public long getSubject() {
        return subject;
    }
}
