package org.persist.context;

import lombok.RequiredArgsConstructor;
import org.hibernate.Session;
import org.hibernate.Transaction;
import org.persist.share.SqlParameter;
import org.springframework.beans.BeanUtils;
import org.springframework.jdbc.core.BeanPropertyRowMapper;
import org.springframework.jdbc.core.CallableStatementCallback;
import org.springframework.jdbc.core.CallableStatementCreator;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SingleColumnRowMapper;
import org.springframework.jdbc.core.SqlTypeValue;
import org.springframework.jdbc.core.StatementCreatorUtils;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.CallableStatement;
import java.sql.ResultSet;
import java.util.List;
import java.util.function.Function;

/**
 * 在会话自身的连接与事务内执行原生SQL
 *
 * @author qiaohe
 * @date 2024/4/3
 */
@RequiredArgsConstructor
public class SessionSqlExecutor {
    private final Session session;

    /**
     * 简单类型取单列，其他类型按列名映射属性
     *
     * @param resultClass
     * @param sql
     * @param parameters
     * @param <T>
     * @return
     */
    public <T> List<T> query(Class<T> resultClass, String sql, SqlParameter... parameters) {
        return withTemplate(template -> template.query(sql, toParameterSource(parameters), rowMapper(resultClass)));
    }

    public int update(String sql, SqlParameter... parameters) {
        return withTemplate(template -> template.update(sql, toParameterSource(parameters)));
    }

    /**
     * 按参数顺序调用 {call name(?, ...)}
     *
     * @param procedureName
     * @param parameters
     * @return 首行首列整数，无返回行时为0
     */
    public int call(String procedureName, SqlParameter... parameters) {
        SqlParameter[] params = parameters == null ? new SqlParameter[0] : parameters;
        String callString = callString(procedureName, params.length);
        Integer result = withTemplate(template -> template.getJdbcTemplate().execute(
                (CallableStatementCreator) connection -> {
                    CallableStatement statement = connection.prepareCall(callString);
                    for (int i = 0; i < params.length; i++) {
                        int sqlType = params[i].hasSqlType()
                                ? params[i].getSqlType()
                                : SqlTypeValue.TYPE_UNKNOWN;
                        StatementCreatorUtils.setParameterValue(statement, i + 1, sqlType, params[i].getValue());
                    }
                    return statement;
                },
                (CallableStatementCallback<Integer>) statement -> {
                    if (!statement.execute()) {
                        return 0;
                    }
                    try (ResultSet resultSet = statement.getResultSet()) {
                        return resultSet != null && resultSet.next()
                                ? resultSet.getInt(1)
                                : 0;
                    }
                }));
        return result == null ? 0 : result;
    }

    private <R> R withTemplate(Function<NamedParameterJdbcTemplate, R> action) {
        // 原生SQL需看到会话内未刷新的变更
        Transaction transaction = session.getTransaction();
        if (transaction != null && transaction.isActive()) {
            session.flush();
        }
        return session.doReturningWork(connection ->
                action.apply(new NamedParameterJdbcTemplate(new SingleConnectionDataSource(connection, true))));
    }

    static String callString(String procedureName, int parameterCount) {
        StringBuilder builder = new StringBuilder("{call ").append(procedureName).append("(");
        for (int i = 0; i < parameterCount; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append("?");
        }
        return builder.append(")}").toString();
    }

    private static MapSqlParameterSource toParameterSource(SqlParameter... parameters) {
        MapSqlParameterSource parameterSource = new MapSqlParameterSource();
        if (parameters == null) {
            return parameterSource;
        }
        for (SqlParameter parameter : parameters) {
            if (parameter.hasSqlType()) {
                parameterSource.addValue(parameter.getName(), parameter.getValue(), parameter.getSqlType());
            } else {
                parameterSource.addValue(parameter.getName(), parameter.getValue());
            }
        }
        return parameterSource;
    }

    private static <T> RowMapper<T> rowMapper(Class<T> resultClass) {
        if (BeanUtils.isSimpleValueType(resultClass)) {
            return SingleColumnRowMapper.newInstance(resultClass);
        }
        return BeanPropertyRowMapper.newInstance(resultClass);
    }
}
