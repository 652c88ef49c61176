package com.sensor.readings.reshaper.service;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.dto.ObjectKey;
import com.sensor.readings.reshaper.exception.InvalidInputException;
import com.sensor.readings.reshaper.exception.UnsupportedObjectException;

/**
 * Service for turning a downloaded readings object into a plain CSV artifact.
 *
 * <p>Objects whose key ends in {@code .gz} are GZIP-decompressed into the target file. Plain
 * {@code .csv} objects are already decoded and are used as they are. Any other suffix is rejected.
 *
 * <p>High-Level Steps: 1. Inspect the key suffix 2. Stream-decompress to disk when compressed 3.
 * Return the path of the plain CSV artifact
 */
@Service
public class DataDecodingService {

  private static final Logger logger = LoggerFactory.getLogger(DataDecodingService.class);

  static final String PLAIN_SUFFIX = ".csv";

  /**
   * Decodes a downloaded object.
   *
   * @param key the key the object was downloaded from
   * @param raw the downloaded bytes on disk
   * @param decoded where to write the decompressed CSV when decompression is needed
   * @return the path holding plain CSV, either {@code decoded} or {@code raw}
   * @throws UnsupportedObjectException if the key is neither {@code .gz} nor {@code .csv}
   * @throws InvalidInputException if a {@code .gz} object is not valid GZIP data
   */
  public Path decode(ObjectKey key, Path raw, Path decoded) {
    requireSupported(key);
    if (key.isCompressed()) {
      long bytes = gunzip(raw, decoded);
      logger.debug("Decompressed {} to {} bytes", key, bytes);
      return decoded;
    }
    logger.debug("Object {} is not compressed, using it as downloaded", key);
    return raw;
  }

  /**
   * Rejects keys that cannot be decoded, so unsupported objects fail before they are downloaded.
   *
   * @param key source key
   * @throws UnsupportedObjectException if the key is neither {@code .gz} nor {@code .csv}
   */
  public void requireSupported(ObjectKey key) {
    if (!key.isCompressed() && !key.fileName().endsWith(PLAIN_SUFFIX)) {
      throw new UnsupportedObjectException(
          "Unsupported object type, expected "
              + ObjectKey.COMPRESSED_SUFFIX
              + " or "
              + PLAIN_SUFFIX
              + ": "
              + key);
    }
  }

  /**
   * Performs the GZIP decompression from one file to another.
   *
   * @param source GZIP-compressed file
   * @param target decompressed output, replaced if present
   * @return number of decompressed bytes
   */
  long gunzip(Path source, Path target) {
    try (InputStream inputStream = Files.newInputStream(source);
        GZIPInputStream gzipInputStream = new GZIPInputStream(inputStream)) {

      return Files.copy(gzipInputStream, target, StandardCopyOption.REPLACE_EXISTING);

    } catch (ZipException e) {
      throw new InvalidInputException("Object is not valid GZIP data: " + e.getMessage(), e);
    } catch (EOFException e) {
      throw new InvalidInputException("GZIP data is truncated: " + source.getFileName(), e);
    } catch (IOException e) {
      throw new UncheckedIOException("GZIP decompression failed for " + source, e);
    }
  }
}
