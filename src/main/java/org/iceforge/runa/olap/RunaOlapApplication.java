package org.iceforge.runa.olap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// The warehouse DataSource is built from runa.olap.warehouse.* and only when the JDBC executor is selected.
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class RunaOlapApplication {

    public static void main(String[] args) {
        SpringApplication.run(RunaOlapApplication.class, args);
    }
}
