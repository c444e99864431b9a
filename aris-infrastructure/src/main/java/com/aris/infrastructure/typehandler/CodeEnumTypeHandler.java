package com.aris.infrastructure.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.function.Function;

/**
 * 以 code 字符串落库的枚举映射处理器。
 */
public abstract class CodeEnumTypeHandler<E extends Enum<E>> extends BaseTypeHandler<E> {

    private final Function<E, String> toCode;
    private final Function<String, E> fromCode;

    protected CodeEnumTypeHandler(Function<E, String> toCode, Function<String, E> fromCode) {
        this.toCode = toCode;
        this.fromCode = fromCode;
    }

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, E parameter, JdbcType jdbcType) throws SQLException {
        ps.setString(i, toCode.apply(parameter));
    }

    @Override
    public E getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return toEnum(rs.getString(columnName));
    }

    @Override
    public E getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return toEnum(rs.getString(columnIndex));
    }

    @Override
    public E getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return toEnum(cs.getString(columnIndex));
    }

    private E toEnum(String code) throws SQLException {
        if (code == null) {
            return null;
        }
        try {
            return fromCode.apply(code);
        } catch (IllegalArgumentException ex) {
            throw new SQLException("Unsupported status code: " + code, ex);
        }
    }
}
