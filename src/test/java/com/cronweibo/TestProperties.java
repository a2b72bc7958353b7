package com.cronweibo;

import com.cronweibo.config.CronweiboProperties;

import java.time.Duration;

public final class TestProperties {

    public static final String SECURITY_URL = "http://sec.example.com";

    private TestProperties() {
    }

    public static CronweiboProperties create(int retryCount) {
        CronweiboProperties props = new CronweiboProperties();
        props.setAppName("testapp");
        props.setTimezone("Asia/Shanghai");
        props.getWeibo().setAppKey("key");
        props.getWeibo().setAppSecret("secret");
        props.getWeibo().setRedirectUri("http://localhost/callback");
        props.getWeibo().setUsername("user");
        props.getWeibo().setPassword("pass");
        props.getWeibo().setSecurityUrl(SECURITY_URL);
        props.getRetry().setCount(retryCount);
        props.getRetry().setInterval(Duration.ZERO);
        return props;
    }
}
