package com.cronweibo.service;

import com.cronweibo.entity.WeiboContent;

/**
 * 웨이보 작업 함수입니다.
 * 인자를 받지 않고, 게시할 본문과 (선택) 이미지를 돌려줍니다.
 * 서비스 사용자가 구현하며, 테스트에서는 람다로 대체합니다.
 */
@FunctionalInterface
public interface WeiboJobFunc {

    WeiboContent produce();
}
