package org.persist.share;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.sql.JDBCType;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 原生SQL参数
 *
 * @author qiaohe
 * @date 2024/4/2
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SqlParameter {
    /**
     * 参数名，对应SQL中的 :name
     */
    private final String name;
    private final Object value;
    /**
     * {@link java.sql.Types} 中的类型，为空时由驱动推断
     */
    private final Integer sqlType;

    public static SqlParameter of(String name, Object value) {
        return new SqlParameter(name, value, null);
    }

    public static SqlParameter of(String name, Object value, int sqlType) {
        return new SqlParameter(name, value, sqlType);
    }

    public boolean hasSqlType() {
        return sqlType != null;
    }

    public String getTypeName() {
        if (sqlType == null) {
            return "UNSPECIFIED";
        }
        try {
            return JDBCType.valueOf(sqlType).getName();
        } catch (IllegalArgumentException ex) {
            return String.valueOf(sqlType);
        }
    }

    @Override
    public String toString() {
        return name + " : " + value + " : " + getTypeName() + "\t";
    }

    /**
     * 日志输出格式 name : value : type，逗号分隔
     *
     * @param parameters
     * @return
     */
    public static String describe(SqlParameter... parameters) {
        if (parameters == null || parameters.length == 0) {
            return "";
        }
        return Arrays.stream(parameters).map(SqlParameter::toString).collect(Collectors.joining(","));
    }
}
