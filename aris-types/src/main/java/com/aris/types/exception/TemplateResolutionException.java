package com.aris.types.exception;

import com.aris.types.enums.ResponseCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 模板变量解析失败。
 * <p>
 * 携带无法解析的标识符以及依次尝试过的解析策略，用于用户可见的错误说明。
 * </p>
 *
 * @author getoffer
 * @since 2025-02-03
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class TemplateResolutionException extends AppException {

    private static final long serialVersionUID = 3021707388455046186L;

    /** 无法解析的标识符 */
    private final String identifier;

    /** 已尝试的解析策略（按顺序） */
    private final List<String> attemptedStrategies;

    public TemplateResolutionException(String identifier, List<String> attemptedStrategies, String message) {
        super(ResponseCode.TEMPLATE_RESOLUTION_FAILURE, message);
        this.identifier = identifier;
        this.attemptedStrategies = attemptedStrategies == null
                ? Collections.emptyList()
                : List.copyOf(attemptedStrategies);
    }

    public static TemplateResolutionException unresolved(String placeholder,
                                                         String identifier,
                                                         List<String> attemptedStrategies) {
        String message = "Unresolved template variable '" + placeholder + "': identifier '" + identifier
                + "' not found (tried " + String.join(", ", attemptedStrategies) + ")";
        return new TemplateResolutionException(identifier, attemptedStrategies, message);
    }

    public static TemplateResolutionException depthExceeded(int maxDepth) {
        return new TemplateResolutionException(null, Collections.emptyList(),
                "Template resolution exceeded max depth " + maxDepth);
    }
}
