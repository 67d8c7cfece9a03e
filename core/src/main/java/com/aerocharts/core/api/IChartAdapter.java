package com.aerocharts.core.api;

import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;

import java.util.List;

/**
 * 백엔드 어댑터 계약.
 * - 원시 (제목, 로케이터) 쌍을 발행 순서대로 반환
 * - 분류/URL 정규화는 하지 않는다
 * - 실패는 가장 구체적인 kind로 던진다. 0건은 빈 리스트(오류 아님)
 * - 공유 상태는 읽기 전용이어야 한다(동시 호출 가능)
 */
public interface IChartAdapter {

    AdapterKind kind();

    List<RawChart> fetch(String identifier, SourceDescriptor descriptor) throws ChartSourceException;
}
