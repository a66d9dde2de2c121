package org.persist.share;

/**
 * 数据上下文配置异常
 *
 * @author qiaohe
 * @date 2024/4/2
 */
public class DataContextException extends RuntimeException {
    public DataContextException(String message) {
        super(message);
    }
    public DataContextException(String message, Throwable innerException) {
        super(message, innerException);
    }
}
