package com.cronweibo.config;

import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;

/** Basic 인증 사용자명/비밀번호가 모두 설정된 경우에만 참 */
public class BasicAuthConfiguredCondition implements Condition {

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return StringUtils.hasText(context.getEnvironment().getProperty("cronweibo.http.basic-auth-username"))
                && StringUtils.hasText(context.getEnvironment().getProperty("cronweibo.http.basic-auth-password"));
    }
}
