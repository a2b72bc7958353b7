package com.cronweibo.example;

import com.cronweibo.entity.WeiboJob;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HelloWorldJobConfigTest {

    @Test
    void helloWorldJobPostsEveryTwoMinutes() {
        WeiboJob job = new HelloWorldJobConfig().helloWorldJob();

        assertEquals("helloworld", job.getName());
        assertEquals("@every 2m", job.getSchedule());
        assertEquals("hello world", job.getRun().produce().getText());
        assertFalse(job.getRun().produce().hasPic());
    }
}
