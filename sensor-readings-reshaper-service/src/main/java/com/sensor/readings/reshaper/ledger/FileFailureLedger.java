package com.sensor.readings.reshaper.ledger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties;
import com.sensor.readings.reshaper.exception.FailureLedgerException;

/**
 * {@link FailureLedger} stored as a UTF-8 text file with one key per newline-terminated line.
 *
 * <p>All operations hold the same lock. Appends write a whole line in one call; rewrites go to a
 * sibling temporary file that is then moved over the ledger, so a reader never observes a partly
 * rewritten ledger.
 */
@Component
public class FileFailureLedger implements FailureLedger {

    private static final Logger logger = LoggerFactory.getLogger(FileFailureLedger.class);

    private final Path ledgerPath;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public FileFailureLedger(ReshaperConfigurationProperties properties) {
        this(properties.ledger().path());
    }

    public FileFailureLedger(Path ledgerPath) {
        this.ledgerPath = ledgerPath.toAbsolutePath();
        logger.info("Failure ledger at {}", this.ledgerPath);
    }

    @Override
    public void append(String key) {
        if (key == null || key.isBlank() || key.contains("\n") || key.contains("\r")) {
            throw new IllegalArgumentException("Ledger key must be a single non-blank line: " + key);
        }
        byte[] line = (key.strip() + "\n").getBytes(StandardCharsets.UTF_8);

        lock.lock();
        try {
            createParentDirectories();
            Files.write(ledgerPath, line,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            logger.debug("Recorded failure: {}", key);
        } catch (IOException e) {
            throw new FailureLedgerException("Failed to append to failure ledger " + ledgerPath, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> readAll() {
        lock.lock();
        try {
            return Files.readAllLines(ledgerPath, StandardCharsets.UTF_8).stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new FailureLedgerException("Failed to read failure ledger " + ledgerPath, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void rewrite(List<String> keys) {
        lock.lock();
        try {
            if (keys.isEmpty()) {
                Files.deleteIfExists(ledgerPath);
                logger.info("Failure ledger cleared");
                return;
            }
            createParentDirectories();
            Path staging = ledgerPath.resolveSibling(ledgerPath.getFileName() + ".tmp");
            String content = keys.stream().map(String::strip).collect(Collectors.joining("\n", "", "\n"));
            Files.writeString(staging, content, StandardCharsets.UTF_8);
            Files.move(staging, ledgerPath,
                StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.info("Failure ledger rewritten with {} keys", keys.size());
        } catch (IOException e) {
            throw new FailureLedgerException("Failed to rewrite failure ledger " + ledgerPath, e);
        } finally {
            lock.unlock();
        }
    }

    public Path path() {
        return ledgerPath;
    }

    private void createParentDirectories() throws IOException {
        Path parent = ledgerPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
