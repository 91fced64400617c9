package net.crontide.core.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 엔진이 내보내는 경고 채널. 엔진은 warn 외에는 로그를 남기지 않는다 */
@FunctionalInterface
public interface EngineLogger {
    void warn(String message);

    static EngineLogger slf4j(Class<?> owner) {
        Logger log = LoggerFactory.getLogger(owner);
        return log::warn;
    }

    static EngineLogger noop() {
        return message -> { };
    }
}
