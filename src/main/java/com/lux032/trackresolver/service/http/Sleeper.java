package com.lux032.trackresolver.service.http;

/**
 * 可替换的等待实现,测试中用记录型实现代替真实 sleep
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
