/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.ComponentScan;

@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = {"ai.asserts.inventory"})
public class InventoryApplication {
    public static void main(String[] args) {
        SpringApplication springApplication = new SpringApplication(InventoryApplication.class);
        // InventoryRunner installs its own hook so that an interrupted scan still writes its partial inventory
        springApplication.setRegisterShutdownHook(false);
        ConfigurableApplicationContext context = springApplication.run(args);
        System.exit(SpringApplication.exit(context));
    }
}
