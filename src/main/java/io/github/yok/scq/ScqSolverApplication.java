package io.github.yok.scq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * scq-solver のエントリポイントです。
 *
 * <p>
 * scq.* の設定から回路を構成し、{@link io.github.yok.scq.app.ScqCliRunner} でスペクトルを掃引します。
 * </p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.github.yok.scq")
public class ScqSolverApplication {

    /**
     * Spring Boot アプリケーションを起動します。
     *
     * @param args 起動引数です
     */
    public static void main(String[] args) {
        SpringApplication.run(ScqSolverApplication.class, args);
    }
}
