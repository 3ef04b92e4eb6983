package com.jdc.recipe_store.domain.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdc.recipe_store.domain.model.Recipe;
import com.jdc.recipe_store.domain.type.RecipeStoreType;
import com.jdc.recipe_store.exception.RecipeAlreadyExistsException;
import com.jdc.recipe_store.exception.RecipeNotFoundException;
import com.jdc.recipe_store.exception.RecipeStorageException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * 레시피 한 건을 {@code <root>/<id>.json} 파일 하나로 저장합니다.
 * <p>
 * 쓰기는 같은 디렉터리의 임시 파일에 먼저 기록한 뒤 원자적 rename으로 교체하므로, 읽는 쪽은 항상 완전한 파일만 봅니다.
 * 같은 id에 대한 쓰기는 id 해시로 나눈 lock stripe로 직렬화합니다.
 */
@Slf4j
public class FileSystemRecipeStore implements RecipeStore {

    static final String EXTENSION = ".json";
    private static final String TEMP_PREFIX = ".tmp-";
    private static final String TEMP_SUFFIX = ".part";
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9-]+");
    private static final int LOCK_STRIPES = 64;

    @Getter
    private final Path root;
    private final ObjectMapper objectMapper;
    private final Lock[] locks = new Lock[LOCK_STRIPES];

    public FileSystemRecipeStore(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;

        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new RecipeStorageException("레시피 저장 디렉터리를 만들 수 없습니다: " + this.root, e);
        }
        if (!Files.isDirectory(this.root) || !Files.isWritable(this.root)) {
            throw new IllegalArgumentException("Recipe store \"" + this.root + "\" is not a writable directory");
        }

        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public Recipe create(String id, Recipe recipe) {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Invalid recipe id: " + id);
        }

        Lock lock = lockFor(id);
        lock.lock();
        try {
            Path target = fileOf(id);
            if (Files.exists(target)) {
                throw new RecipeAlreadyExistsException(id);
            }
            Recipe stored = recipe.withId(id);
            writeAtomically(target, stored);
            return stored;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Recipe get(String id) {
        if (!isValidId(id)) {
            throw new RecipeNotFoundException(id);
        }
        return read(id);
    }

    @Override
    public List<Recipe> list() {
        List<Recipe> recipes = new ArrayList<>();
        for (String id : listIds()) {
            try {
                recipes.add(read(id));
            } catch (RecipeNotFoundException e) {
                // 목록 조회와 읽기 사이에 삭제된 파일
                log.debug("목록 조회 중 삭제된 레시피 건너뜀: {}", id);
            }
        }
        return recipes;
    }

    @Override
    public Recipe update(String id, Recipe recipe) {
        if (!isValidId(id)) {
            throw new RecipeNotFoundException(id);
        }

        Lock lock = lockFor(id);
        lock.lock();
        try {
            Path target = fileOf(id);
            if (!Files.exists(target)) {
                throw new RecipeNotFoundException(id);
            }
            Recipe stored = recipe.withId(id);
            writeAtomically(target, stored);
            return stored;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String id) {
        if (!isValidId(id)) {
            throw new RecipeNotFoundException(id);
        }

        Lock lock = lockFor(id);
        lock.lock();
        try {
            if (!Files.deleteIfExists(fileOf(id))) {
                throw new RecipeNotFoundException(id);
            }
        } catch (IOException e) {
            throw new RecipeStorageException("레시피 파일 삭제 실패: " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clearAll() {
        List<String> ids = listIds();
        for (String id : ids) {
            Lock lock = lockFor(id);
            lock.lock();
            try {
                Files.deleteIfExists(fileOf(id));
            } catch (IOException e) {
                throw new RecipeStorageException("레시피 파일 삭제 실패: " + id, e);
            } finally {
                lock.unlock();
            }
        }
        log.info("파일 저장소 전체 삭제: {}건 ({})", ids.size(), root);
    }

    @Override
    public long count() {
        return listIds().size();
    }

    @Override
    public RecipeStoreType backend() {
        return RecipeStoreType.FS;
    }

    private Recipe read(String id) {
        byte[] contents;
        try {
            contents = Files.readAllBytes(fileOf(id));
        } catch (NoSuchFileException e) {
            throw new RecipeNotFoundException(id);
        } catch (IOException e) {
            throw new RecipeStorageException("레시피 파일 읽기 실패: " + id, e);
        }

        try {
            return objectMapper.readValue(contents, Recipe.class).withId(id);
        } catch (IOException e) {
            throw new RecipeStorageException("레시피 파일 파싱 실패: " + id, e);
        }
    }

    private void writeAtomically(Path target, Recipe recipe) {
        Path temp = null;
        try {
            byte[] contents = objectMapper.writeValueAsBytes(recipe);
            temp = Files.createTempFile(root, TEMP_PREFIX, TEMP_SUFFIX);

            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(contents);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            temp = null;
        } catch (IOException e) {
            throw new RecipeStorageException("레시피 파일 쓰기 실패: " + target.getFileName(), e);
        } finally {
            if (temp != null) {
                deleteTempQuietly(temp);
            }
        }
    }

    private void deleteTempQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("임시 파일 삭제 실패: {}", temp, e);
        }
    }

    private List<String> listIds() {
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(root, "*" + EXTENSION)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String id = name.substring(0, name.length() - EXTENSION.length());
                if (isValidId(id) && Files.isRegularFile(file)) {
                    ids.add(id);
                }
            }
        } catch (IOException e) {
            throw new RecipeStorageException("레시피 디렉터리 조회 실패: " + root, e);
        }
        ids.sort(null);
        return ids;
    }

    private Path fileOf(String id) {
        return root.resolve(id + EXTENSION);
    }

    private Lock lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
    }

    private static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }
}
