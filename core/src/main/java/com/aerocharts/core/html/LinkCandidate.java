package com.aerocharts.core.html;

/**
 * 페이지에서 찾은 문서 링크 1개.
 * href는 원문 그대로(상대 경로 가능), context는 같은 행/컨테이너 텍스트, heading은 가장 가까운 앞 제목.
 */
public final class LinkCandidate {
    private final String href;
    private final String title;
    private final String context;
    private final String heading;

    LinkCandidate(String href, String title, String context, String heading) {
        this.href = href;
        this.title = title;
        this.context = context == null ? "" : context;
        this.heading = heading;
    }

    public String getHref() { return href; }
    public String getTitle() { return title; }
    public String getContext() { return context; }
    /** 없으면 null */
    public String getHeading() { return heading; }

    @Override
    public String toString() {
        return "LinkCandidate{title='" + title + "', href='" + href + "'}";
    }
}
