package net.moznion.dispatchq.misc;

public class Constant {
    public static final String REDIS_HOST = "127.0.0.1";
    public static final int REDIS_PORT = 6379;
    public static final String NAMESPACE_FOR_TESTING = "dispatchq-testing";
}
