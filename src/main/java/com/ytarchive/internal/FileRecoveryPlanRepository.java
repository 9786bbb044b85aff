package com.ytarchive.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ytarchive.RecoveryPlanEntry;
import com.ytarchive.RecoveryPlanRepository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recovery plan stored as one JSON array. Entries are merged by item id and never removed.
 */
public class FileRecoveryPlanRepository implements RecoveryPlanRepository {

    private static final TypeReference<List<RecoveryPlanEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, RecoveryPlanEntry> entries = new LinkedHashMap<>();

    public FileRecoveryPlanRepository(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        load();
    }

    @Override
    public synchronized RecoveryPlanEntry record(RecoveryPlanEntry entry) {
        RecoveryPlanEntry merged = entries.merge(entry.itemId(), entry, RecoveryPlanEntry::mergeWith);
        write();
        return merged;
    }

    @Override
    public synchronized List<RecoveryPlanEntry> findAll() {
        return List.copyOf(entries.values());
    }

    @Override
    public synchronized Optional<RecoveryPlanEntry> findByItemId(String itemId) {
        return Optional.ofNullable(entries.get(itemId));
    }

    private void write() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new ArrayList<>(entries.values()));
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write recovery plan " + file, e);
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            for (RecoveryPlanEntry entry : objectMapper.readValue(file.toFile(), ENTRY_LIST)) {
                entries.merge(entry.itemId(), entry, RecoveryPlanEntry::mergeWith);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read recovery plan " + file, e);
        }
    }
}
