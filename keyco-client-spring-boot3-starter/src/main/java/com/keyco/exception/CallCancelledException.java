package com.keyco.exception;

import java.io.IOException;

/**
 * 调用方取消了在途请求
 * 永不重试, 不计入熔断
 */
public class CallCancelledException extends IOException {

    public CallCancelledException(Throwable cause) {
        super("call cancelled", cause);
    }
}
