package com.cronweibo.entity;

import lombok.Getter;
import lombok.ToString;

/**
 * 작업 함수가 만들어 낸 게시 내용입니다.
 * 이미지는 재시도 때마다 같은 내용을 올릴 수 있도록 바이트 배열 사본으로 보관합니다.
 */
@Getter
@ToString
public class WeiboContent {

    /** 게시 본문 */
    private final String text;

    /** 첨부 이미지 (없으면 null) */
    @ToString.Exclude
    private final byte[] pic;

    public WeiboContent(String text, byte[] pic) {
        this.text = text;
        this.pic = pic == null ? null : pic.clone();
    }

    public static WeiboContent text(String text) {
        return new WeiboContent(text, null);
    }

    public boolean hasPic() {
        return pic != null && pic.length > 0;
    }
}
