package com.aris.infrastructure.typehandler;

import com.aris.types.enums.ActionStatusEnum;
import org.apache.ibatis.type.MappedTypes;

/**
 * actions.status 映射。
 */
@MappedTypes(ActionStatusEnum.class)
public class ActionStatusTypeHandler extends CodeEnumTypeHandler<ActionStatusEnum> {

    public ActionStatusTypeHandler() {
        super(ActionStatusEnum::getCode, ActionStatusEnum::fromCode);
    }
}
