package com.sensor.readings.reshaper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Sensor Readings Reshaper.
 *
 * <p>This batch service relocates historical sensor readings stored in S3. Every long-format file
 * is archived unchanged, pivoted to wide format, republished and finally removed from its source
 * location.
 *
 * <p><strong>Key Responsibilities:</strong>
 *
 * <ul>
 *   <li>Enumerates (location, year) partitions of the configured locations
 *   <li>Processes partitions concurrently on a bounded worker pool
 *   <li>Uploads with retry and exponential backoff
 *   <li>Records incomplete files in a failure ledger and re-drives them after the main pass
 * </ul>
 *
 * <p>The job runs once and the process exits with the code reported by the job runner.
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.sensor.readings.reshaper.config.properties")
public class SensorReadingsReshaperApplication {

  /**
   * Main entry point for the Sensor Readings Reshaper.
   *
   * @param args Command line arguments passed to the application
   */
  public static void main(String[] args) {
    System.exit(
        SpringApplication.exit(SpringApplication.run(SensorReadingsReshaperApplication.class, args)));
  }
}
