package com.bricks.sorter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the Brick Sorter application.
 *
 * <p>This Spring Boot application turns a parts inventory into sorting bins:
 * <ul>
 *   <li>loads a Rebrickable JSON/CSV, BrickStore XML or LDCad PBG list, or a
 *       Rebrickable set number,</li>
 *   <li>enriches every part with its BrickArchitect category path and image,
 *       cached in a local H2 database,</li>
 *   <li>clusters the parts with weighted k-means and renders the bins as HTML.</li>
 * </ul>
 * </p>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 *
 *   curl -F partList=@inventory.csv -F clusters=12 http://localhost:8080/api/clusters
 * }</pre>
 */
@SpringBootApplication
public class BrickSorterApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(BrickSorterApplication.class, args);
    }
}
