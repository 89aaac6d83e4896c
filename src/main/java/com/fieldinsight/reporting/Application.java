package com.fieldinsight.reporting;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 应用程序主类
 */
@QuarkusMain
public class Application {

    public static void main(String[] args) {
        Quarkus.run(App.class, args);
    }

    public static class App implements QuarkusApplication {

        private static final Logger log = LoggerFactory.getLogger(App.class);

        @Override
        public int run(String... args) {
            log.info("[Startup] Field Insight reporting engine ready");
            Quarkus.waitForExit();
            return 0;
        }
    }
}
