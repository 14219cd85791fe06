package com.asiainfo.deepdive.core.drilldown;

import com.asiainfo.deepdive.core.model.DeepDiveQuery;
import com.asiainfo.deepdive.core.model.DeepDiveResult;

/**
 * 执行一次两期对比
 */
@FunctionalInterface
public interface ComparisonFetcher {

    /**
     * @throws com.asiainfo.deepdive.infra.persistence.DataSourceException 数据仓库失败
     */
    DeepDiveResult fetch(DeepDiveQuery query);
}
