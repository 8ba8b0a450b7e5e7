package com.minisessiondb.storage.impl;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.metadata.ContainerDefinition;
import com.minisessiondb.metadata.ContainerType;
import com.minisessiondb.storage.record.StoredRecord;
import com.minisessiondb.storage.table.Container;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FileRecordStore - 文件记录存储
 *
 * 目录布局:
 * <pre>
 * dataDir/
 *   schema.json               版本号 + 容器定义(含索引)
 *   sessions.json             每个容器一个JSON数组
 *   tabs.json
 *   navigation_events.json
 *   session_boundaries.json
 *   metadata.json
 * </pre>
 *
 * 写入策略:
 * - 读写事务提交时,只重写被修改的容器文件
 * - 先把所有脏容器写到 .tmp,正式文件复制为 .bak
 * - 写入提交日志 commit.journal,再依次原子重命名覆盖正式文件
 * - 全部重命名成功后删除日志(提交点),再清理 .bak
 * - 重命名失败时用 .bak 恢复已覆盖的文件,抛出StorageException,内存中的修改随事务回滚
 * - 打开时发现遗留的提交日志,说明上次提交未完成,按日志用 .bak 撤销
 *
 * 索引不落盘,打开时根据容器定义重建。
 */
public class FileRecordStore extends AbstractRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(FileRecordStore.class);

    static final String SCHEMA_FILE = "schema.json";

    private static final String DATA_SUFFIX = ".json";

    private static final String TMP_SUFFIX = ".tmp";

    private static final String BACKUP_SUFFIX = ".bak";

    static final String JOURNAL_FILE = "commit.journal";

    private final Path dataDir;

    private final ObjectMapper mapper;

    public FileRecordStore(Path dataDir) {
        super();
        if (dataDir == null) {
            throw new IllegalArgumentException("Data directory cannot be null");
        }
        this.dataDir = dataDir;
        this.mapper = ObjectMappers.standard();
    }

    public Path getDataDir() {
        return dataDir;
    }

    @Override
    public int peekVersion() {
        if (isOpen()) {
            return version;
        }
        StoreSchemaFile schema = readSchemaFile();
        return schema == null ? 0 : schema.getVersion();
    }

    @Override
    protected void loadState() {
        containers.clear();
        version = 0;

        recoverInterruptedCommit();

        StoreSchemaFile schema = readSchemaFile();
        if (schema == null) {
            logger.info("数据目录中没有schema文件,按全新存储打开: {}", dataDir);
            return;
        }

        for (ContainerDefinition definition : schema.getContainers()) {
            Container container = new Container(definition);
            for (StoredRecord record : readContainerFile(container.getType())) {
                container.put(record);
            }
            containers.put(definition.getName(), container);
        }
        version = schema.getVersion();
        logger.info("从 {} 加载存储: version={}, containers={}", dataDir, version, containers.keySet());
    }

    @Override
    protected void onCommit(Set<String> dirtyContainers) {
        Map<Path, Path> pending = new LinkedHashMap<>();
        try {
            for (String name : dirtyContainers) {
                Container container = getContainer(name);
                if (container == null) {
                    continue;
                }
                Path target = dataDir.resolve(name + DATA_SUFFIX);
                pending.put(writeTemp(target, new ArrayList<>(container.values())), target);
            }
        } catch (StorageException e) {
            discard(pending.keySet());
            throw e;
        }
        commitTemps(pending);
    }

    @Override
    protected void persistAll() {
        Map<Path, Path> pending = new LinkedHashMap<>();

        StoreSchemaFile schema = new StoreSchemaFile();
        schema.setVersion(version);
        List<ContainerDefinition> definitions = new ArrayList<>();
        try {
            for (Container container : containers.values()) {
                definitions.add(container.getDefinition());
                Path target = dataDir.resolve(container.getName() + DATA_SUFFIX);
                pending.put(writeTemp(target, new ArrayList<>(container.values())), target);
            }
            schema.setContainers(definitions);

            Path schemaPath = dataDir.resolve(SCHEMA_FILE);
            pending.put(writeTemp(schemaPath, schema), schemaPath);
        } catch (StorageException e) {
            discard(pending.keySet());
            throw e;
        }
        commitTemps(pending);

        // 升级中被删除的容器
        for (ContainerType type : ContainerType.values()) {
            if (!containers.containsKey(type.getContainerName())) {
                try {
                    Files.deleteIfExists(dataDir.resolve(type.getContainerName() + DATA_SUFFIX));
                } catch (IOException e) {
                    throw new StorageException("Failed to delete container file: " + type.getContainerName(), e);
                }
            }
        }
    }

    private StoreSchemaFile readSchemaFile() {
        Path schemaPath = dataDir.resolve(SCHEMA_FILE);
        if (!Files.exists(schemaPath)) {
            return null;
        }
        try {
            return mapper.readValue(schemaPath.toFile(), StoreSchemaFile.class);
        } catch (IOException e) {
            throw new StorageException("Failed to read schema file: " + schemaPath, e);
        }
    }

    private List<? extends StoredRecord> readContainerFile(ContainerType type) {
        Path path = dataDir.resolve(type.getContainerName() + DATA_SUFFIX);
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        try {
            JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, type.getRecordClass());
            return mapper.readValue(path.toFile(), listType);
        } catch (IOException e) {
            throw new StorageException("Failed to read container file: " + path, e);
        }
    }

    private Path writeTemp(Path target, Object value) {
        Path tempPath = Path.of(target + TMP_SUFFIX);
        try {
            Files.createDirectories(dataDir);
            Files.write(tempPath, mapper.writeValueAsBytes(value));
            return tempPath;
        } catch (IOException e) {
            throw new StorageException("Failed to write " + target.getFileName(), e);
        }
    }

    /**
     * 把临时文件提交为正式文件
     *
     * 提交日志存在期间,正式文件可能是新旧混合的状态;日志删除后提交才算完成。
     *
     * @param pending 临时文件 → 正式文件
     * @throws StorageException 任一文件提交失败(已覆盖的文件会被恢复)
     */
    private void commitTemps(Map<Path, Path> pending) {
        CommitJournal journal = new CommitJournal();
        try {
            for (Path target : pending.values()) {
                String name = target.getFileName().toString();
                journal.getTargets().add(name);
                if (Files.isRegularFile(target)) {
                    Files.copy(target, backupPath(target), StandardCopyOption.REPLACE_EXISTING);
                    journal.getBackups().add(name);
                }
            }
            writeJournal(journal);
        } catch (IOException | StorageException e) {
            discard(pending.keySet());
            discardBackups(journal);
            throw new StorageException("Failed to prepare commit in " + dataDir, e);
        }

        List<Path> committed = new ArrayList<>();
        for (Map.Entry<Path, Path> entry : pending.entrySet()) {
            try {
                Files.move(entry.getKey(), entry.getValue(),
                        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                committed.add(entry.getValue());
            } catch (IOException e) {
                discard(pending.keySet());
                undo(journal, committed);
                throw new StorageException("Failed to commit " + entry.getValue().getFileName(), e);
            }
        }

        try {
            Files.deleteIfExists(dataDir.resolve(JOURNAL_FILE));
        } catch (IOException e) {
            undo(journal, committed);
            throw new StorageException("Failed to complete commit in " + dataDir, e);
        }
        discardBackups(journal);
    }

    /**
     * 用 .bak 恢复已被覆盖的文件,全部恢复后删除提交日志
     *
     * 恢复失败时保留日志,下次打开时再撤销。
     */
    private void undo(CommitJournal journal, List<Path> committed) {
        try {
            for (Path target : committed) {
                String name = target.getFileName().toString();
                if (journal.getBackups().contains(name)) {
                    Files.move(backupPath(target), target,
                            StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.deleteIfExists(target);
                }
            }
            Files.deleteIfExists(dataDir.resolve(JOURNAL_FILE));
            discardBackups(journal);
            logger.warn("提交失败,已恢复 {} 个容器文件", committed.size());
        } catch (IOException e) {
            logger.error("提交失败后恢复文件出错,下次打开时按提交日志撤销: {}", e.getMessage(), e);
        }
    }

    private void recoverInterruptedCommit() {
        Path journalPath = dataDir.resolve(JOURNAL_FILE);
        if (!Files.exists(journalPath)) {
            return;
        }
        CommitJournal journal;
        try {
            journal = mapper.readValue(journalPath.toFile(), CommitJournal.class);
        } catch (IOException e) {
            throw new StorageException("Failed to read commit journal: " + journalPath, e);
        }
        logger.warn("发现未完成的提交,按提交日志撤销: {}", journal.getTargets());
        try {
            for (String name : journal.getTargets()) {
                Path target = dataDir.resolve(name);
                Files.deleteIfExists(Path.of(target + TMP_SUFFIX));
                if (journal.getBackups().contains(name)) {
                    Path backup = backupPath(target);
                    if (Files.exists(backup)) {
                        Files.move(backup, target,
                                StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                    }
                } else {
                    Files.deleteIfExists(target);
                }
            }
            Files.delete(journalPath);
        } catch (IOException e) {
            throw new StorageException("Failed to recover interrupted commit in " + dataDir, e);
        }
    }

    private void writeJournal(CommitJournal journal) {
        Path journalPath = dataDir.resolve(JOURNAL_FILE);
        Path tempPath = writeTemp(journalPath, journal);
        try {
            Files.move(tempPath, journalPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            discard(List.of(tempPath));
            throw new StorageException("Failed to write commit journal", e);
        }
    }

    private void discardBackups(CommitJournal journal) {
        List<Path> backups = new ArrayList<>();
        for (String name : journal.getBackups()) {
            backups.add(backupPath(dataDir.resolve(name)));
        }
        discard(backups);
    }

    private void discard(Iterable<Path> paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                logger.warn("无法删除临时文件 {}: {}", path, e.getMessage());
            }
        }
    }

    private static Path backupPath(Path target) {
        return Path.of(target + BACKUP_SUFFIX);
    }

    /**
     * commit.journal 的文件结构
     *
     * targets: 本次提交涉及的正式文件名;backups: 其中提交前已存在、有 .bak 副本的文件名
     */
    public static class CommitJournal {

        private List<String> targets = new ArrayList<>();

        private List<String> backups = new ArrayList<>();

        public List<String> getTargets() {
            return targets;
        }

        public void setTargets(List<String> targets) {
            this.targets = targets;
        }

        public List<String> getBackups() {
            return backups;
        }

        public void setBackups(List<String> backups) {
            this.backups = backups;
        }
    }

    /**
     * schema.json 的文件结构
     */
    public static class StoreSchemaFile {

        private int version;

        private List<ContainerDefinition> containers = new ArrayList<>();

        public int getVersion() {
            return version;
        }

        public void setVersion(int version) {
            this.version = version;
        }

        public List<ContainerDefinition> getContainers() {
            return containers;
        }

        public void setContainers(List<ContainerDefinition> containers) {
            this.containers = containers;
        }
    }
}
