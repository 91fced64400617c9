package net.crontide.core.spi;

import java.util.concurrent.ThreadLocalRandom;

/** [0, 1) 균등 분포 난수. 여러 스레드에서 동시에 불려도 안전해야 한다 */
@FunctionalInterface
public interface RandomSource {
    double nextDouble();

    static RandomSource threadLocal() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }
}
