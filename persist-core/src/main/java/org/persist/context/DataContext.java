package org.persist.context;

import org.persist.share.SqlParameter;

import java.util.List;

/**
 * 数据上下文
 * 包装一个ORM会话，提供增删改、提交与原生SQL执行
 *
 * @author qiaohe
 * @date 2024/4/2
 */
public interface DataContext extends AutoCloseable {

    /**
     * 获取实体的延迟查询，终结操作前不访问数据库
     *
     * @param entityClass
     * @param <T>
     * @return
     */
    <T> Queryable<T> asQueryable(Class<T> entityClass);

    /**
     * 新增实体
     *
     * @param item
     * @param <T>
     * @return 传入的实体
     */
    <T> T add(T item);

    /**
     * 删除实体
     *
     * @param item
     * @param <T>
     * @return 传入的实体
     */
    <T> T remove(T item);

    /**
     * 更新实体
     *
     * @param item
     * @param <T>
     * @return 传入的实体
     */
    <T> T update(T item);

    /**
     * 将实体纳入上下文跟踪
     *
     * @param item
     * @param <T>
     * @return 传入的实体
     */
    <T> T attach(T item);

    /**
     * 将实体移出上下文跟踪
     *
     * @param item
     * @param <T>
     * @return 传入的实体
     */
    <T> T detach(T item);

    /**
     * 从数据库重新加载实体状态
     *
     * @param item
     * @param <T>
     * @return 传入的实体
     */
    <T> T reload(T item);

    /**
     * 提交当前事务
     *
     * @return 影响行数
     */
    int commit();

    /**
     * 执行原生查询，按列名映射为结果类型
     *
     * @param resultClass
     * @param sql
     * @param parameters
     * @param <T>
     * @return
     */
    <T> List<T> executeSqlQuery(Class<T> resultClass, String sql, SqlParameter... parameters);

    /**
     * 执行原生命令
     *
     * @param sql
     * @param parameters
     * @return 影响行数
     */
    int executeSqlCommand(String sql, SqlParameter... parameters);

    /**
     * 调用存储函数/过程
     *
     * @param procedureName
     * @param parameters
     * @return 首行首列的整数值，无返回行时为0
     */
    int executeFunction(String procedureName, SqlParameter... parameters);

    @Override
    void close();
}
