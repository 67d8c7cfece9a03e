package com.aerocharts.core.api;

import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.ChartsResult;

/** 표현 계층이 쓰는 해석 진입점 */
public interface IChartResolver {

    /** 접두사 라우팅으로 소스를 골라 해석 */
    ChartsResult resolve(String identifier) throws ChartSourceException;

    /** 소스를 직접 지정(sourceId가 null이면 라우팅) */
    ChartsResult resolve(String identifier, String sourceId) throws ChartSourceException;
}
