package com.asiainfo.deepdive.infra.persistence;

import java.util.List;

/**
 * 数据仓库查询接口
 */
public interface WarehouseClient {

    /**
     * 按分组键聚合一个周期内的指标
     *
     * @throws DataSourceException 查询失败或超时
     */
    List<WarehouseRow> queryAggregates(AggregateQuery query);
}
