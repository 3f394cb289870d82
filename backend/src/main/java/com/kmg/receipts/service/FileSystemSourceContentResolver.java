package com.kmg.receipts.service;

import com.kmg.receipts.config.ReceiptsProperties;
import com.kmg.receipts.model.ReceiptInput;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

@Service
public class FileSystemSourceContentResolver implements SourceContentResolver {
    private static final Map<String, String> IMAGE_TYPES = Map.of(
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "webp", "image/webp"
    );

    private final Path root;

    public FileSystemSourceContentResolver(ReceiptsProperties properties) {
        this.root = Path.of(properties.getStorage().getDir()).toAbsolutePath().normalize();
    }

    @Override
    public ReceiptInput resolve(String sourceType, String sourceId) {
        Path typeDir = root.resolve(sourceType).normalize();
        Path file = typeDir.resolve(sourceId).normalize();
        if (!root.equals(typeDir.getParent()) || !file.startsWith(typeDir) || file.equals(typeDir)) {
            throw new SourceUnavailableException("Source escapes storage directory: " + sourceType + "/" + sourceId);
        }
        if (!Files.isRegularFile(file)) {
            throw new SourceUnavailableException("Source not found: " + sourceType + "/" + sourceId);
        }

        String ext = extension(file);
        try {
            if ("txt".equals(ext)) {
                return ReceiptInput.text(Files.readString(file, StandardCharsets.UTF_8));
            }
            String mimeType = IMAGE_TYPES.get(ext);
            if (mimeType == null) {
                throw new SourceUnavailableException("Unsupported source format: " + file.getFileName());
            }
            return ReceiptInput.image(Files.readAllBytes(file), mimeType);
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to read source " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private String extension(Path path) {
        String name = path.getFileName().toString();
        int idx = name.lastIndexOf('.');
        if (idx < 0) {
            return "";
        }
        return name.substring(idx + 1).toLowerCase(Locale.ROOT);
    }
}
