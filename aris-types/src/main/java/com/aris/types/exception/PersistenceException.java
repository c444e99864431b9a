package com.aris.types.exception;

import com.aris.types.enums.ResponseCode;

/**
 * 持久化失败。计划创建阶段抛出时，计划不会进入执行。
 */
public class PersistenceException extends AppException {

    private static final long serialVersionUID = -2412980263015735094L;

    public PersistenceException(String message, Throwable cause) {
        super(ResponseCode.PERSISTENCE_FAILURE, message, cause);
    }
}
