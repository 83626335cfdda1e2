package personal.yacht.charter.offline.adapter.out.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.yacht.charter.offline.application.config.OfflineQueueProperties;
import personal.yacht.charter.offline.application.port.out.QueueStore;
import personal.yacht.charter.offline.domain.exception.QueueStoreCapacityExceededException;
import personal.yacht.charter.offline.domain.model.QueueItem;
import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * File Queue Store Adapter
 * 대기열 목록을 JSON 파일로 저장 (임시 파일 기록 후 교체)
 *
 * <p>직렬화 결과가 store.max-bytes를 넘으면 쓰지 않고 용량 초과 예외를 던진다.
 * 파일이 없거나 읽을 수 없으면 빈 대기열로 시작한다.
 */
@Slf4j
@Component
public class FileQueueStoreAdapter implements QueueStore {

    private static final TypeReference<List<QueueItem>> ITEM_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path path;
    private final long maxBytes;

    public FileQueueStoreAdapter(ObjectMapper objectMapper, OfflineQueueProperties properties) {
        this.objectMapper = objectMapper;
        this.path = Path.of(properties.store().path());
        this.maxBytes = properties.store().maxBytes();
    }

    @Override
    public List<QueueItem> load() {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            List<QueueItem> items = objectMapper.readValue(path.toFile(), ITEM_LIST);
            log.debug("Offline queue loaded: path={}, items={}", path, items.size());
            return items;
        } catch (IOException e) {
            log.error("Failed to read offline queue, starting empty: path={}", path, e);
            return List.of();
        }
    }

    @Override
    public void save(List<QueueItem> items) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(items);
            if (json.length > maxBytes) {
                throw new QueueStoreCapacityExceededException(json.length, maxBytes);
            }

            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.write(temp, json);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new BusinessException(ErrorCode.QUEUE_STORE_FAILURE,
                    String.format("Failed to write offline queue: path=%s", path), e);
        }
    }
}
