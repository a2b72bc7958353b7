package com.cronweibo.client;

import com.cronweibo.entity.AccessToken;
import com.cronweibo.entity.ShareResponse;

/**
 * 웨이보 인증/게시 프로토콜을 감싸는 클라이언트 계층입니다.
 * 실패는 모두 {@link com.cronweibo.exception.WeiboApiException} 으로 던집니다.
 */
public interface WeiboClient {

    /** 계정으로 로그인하여 세션을 만듭니다. */
    void login();

    /** 인가 코드를 받아옵니다. */
    String authorize();

    /** 인가 코드를 access_token 으로 교환합니다. (createdAt 은 호출자가 채움) */
    AccessToken accessToken(String code);

    /** 본문과 (선택) 이미지를 게시합니다. */
    ShareResponse statusesShare(String accessToken, String text, byte[] pic);
}
