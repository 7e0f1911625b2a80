package com.webaudit.core.model;

/**
 * 모든 탐지 결과의 공통 베이스.
 * 변형(kind)별 필드는 각 record에 있고, 여기서는 공통 필드만 노출한다.
 *
 * @see PortFinding
 * @see HeaderFinding
 * @see XssFinding
 * @see SqliFinding
 * @see SqlmapFinding
 */
public interface Finding {

    FindingKind kind();

    /** URL 또는 host:port */
    String location();

    Severity severity();

    /** 페이로드/마커/유사도/원문 라인 등 사람이 읽는 근거 */
    String evidence();

    /** 대시보드에서 강조 표시할지 여부 */
    boolean actionable();
}
