package com.aris.infrastructure.typehandler;

import com.aris.types.enums.PlanStatusEnum;
import org.apache.ibatis.type.MappedTypes;

/**
 * plans.status 映射。
 */
@MappedTypes(PlanStatusEnum.class)
public class PlanStatusTypeHandler extends CodeEnumTypeHandler<PlanStatusEnum> {

    public PlanStatusTypeHandler() {
        super(PlanStatusEnum::getCode, PlanStatusEnum::fromCode);
    }
}
