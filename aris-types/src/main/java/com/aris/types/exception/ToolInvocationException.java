package com.aris.types.exception;

import com.aris.types.enums.ToolErrorKindEnum;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 工具调用异常，按 {@link ToolErrorKindEnum} 分类。
 *
 * @author getoffer
 * @since 2025-02-03
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class ToolInvocationException extends AppException {

    private static final long serialVersionUID = -6605913398154301176L;

    private final ToolErrorKindEnum kind;

    private final String toolName;

    public ToolInvocationException(ToolErrorKindEnum kind, String toolName, String detail) {
        this(kind, toolName, detail, null);
    }

    public ToolInvocationException(ToolErrorKindEnum kind, String toolName, String detail, Throwable cause) {
        super(kind.getResponseCode(), detail, cause);
        this.kind = kind;
        this.toolName = toolName;
    }
}
