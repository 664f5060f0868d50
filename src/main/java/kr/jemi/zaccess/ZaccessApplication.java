package kr.jemi.zaccess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.modulith.Modulithic;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@Modulithic(sharedModules = { "common", "config" })
@EnableAsync
@EnableScheduling
@SpringBootApplication
public class ZaccessApplication {
    public static void main(String[] args) {
        SpringApplication.run(ZaccessApplication.class, args);
    }
}
