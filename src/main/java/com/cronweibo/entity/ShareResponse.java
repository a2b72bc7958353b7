package com.cronweibo.entity;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * statuses/share 응답 중 필요한 값만 담는 DTO입니다.
 */
@Getter
@Setter
@ToString
public class ShareResponse {
    /** 게시물 ID */
    private String id;
    /** 작성자 프로필 경로 (ex. u/1234567890) */
    private String profileUrl;

    public ShareResponse() {
    }

    public ShareResponse(String id, String profileUrl) {
        this.id = id;
        this.profileUrl = profileUrl;
    }

    /** 결과 확인용 웨이보 주소 */
    public String weiboUrl() {
        return "http://weibo.com/" + (profileUrl == null ? "" : profileUrl);
    }
}
