package com.shelfsync.converter.service.image;

import com.shelfsync.converter.repository.CatalogRepository;
import com.shelfsync.converter.repository.JdbcStoreFactory;
import com.shelfsync.converter.util.JsonSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ImageDedupServiceTest {
    private static final String STORAGE = "https://storage.example";

    @TempDir
    Path dir;

    private CatalogRepository catalog;
    private RecordingStorage storage;

    /** Everything under the storage origin is managed; deletes are recorded or fail on demand. */
    static class RecordingStorage implements ImageStorageGateway {
        final List<String> deleted = new ArrayList<>();
        boolean fail;

        @Override
        public boolean isManaged(String url) {
            return url.startsWith(STORAGE + "/images/");
        }

        @Override
        public void delete(String url) {
            if (fail) throw new ImageDeleteException(url, "storage returned 500", null);
            deleted.add(url);
        }
    }

    // URLs that differ only after '#' share a fingerprint
    private static final ImageFingerprinter BY_PREFIX = url -> url.contains("#") ? url.substring(0, url.indexOf('#')) : url;

    @BeforeEach
    public void setUp() {
        catalog = new JdbcStoreFactory(JsonSupport.objectMapper()).openCatalog(dir.resolve("catalog.db").toString());
        catalog.ensureSchema();
        storage = new RecordingStorage();
    }

    @AfterEach
    public void tearDown() {
        catalog.close();
    }

    @Test
    public void keepsFirstSeenUrlOfEachGroup() {
        ImageDedupService service = new ImageDedupService(catalog, BY_PREFIX, storage, true);
        List<String> input = List.of(
                STORAGE + "/images/a.jpg",
                STORAGE + "/images/b.jpg",
                STORAGE + "/images/a.jpg#copy",
                STORAGE + "/images/b.jpg");

        ImageDedupResult result = service.dedupe("p-1", input);
        assertEquals(List.of(STORAGE + "/images/a.jpg", STORAGE + "/images/b.jpg"), result.kept());
        assertEquals(List.of(STORAGE + "/images/a.jpg#copy"), result.removed());
        assertEquals(List.of(STORAGE + "/images/a.jpg#copy"), storage.deleted);
        assertEquals(2, result.fingerprints().size());

        Set<String> union = new HashSet<>(result.kept());
        union.addAll(result.removed());
        assertEquals(new HashSet<>(input), union);
    }

    @Test
    public void storedFingerprintIsReused() {
        catalog.registerImage("https://cdn.example/x.jpg", "fp-x");
        ImageDedupService service = new ImageDedupService(catalog, url -> {
            throw new AssertionError("fingerprinter must not be called for known URLs");
        }, storage, true);

        ImageDedupResult result = service.dedupe("p-1", List.of("https://cdn.example/x.jpg"));
        assertEquals(List.of("fp-x"), result.fingerprints());
    }

    @Test
    public void foreignDuplicatesAreNotDeleted() {
        ImageDedupService service = new ImageDedupService(catalog, BY_PREFIX, storage, true);
        ImageDedupResult result = service.dedupe("p-1", List.of("https://cdn.example/x.jpg", "https://cdn.example/x.jpg#2"));
        assertEquals(List.of("https://cdn.example/x.jpg#2"), result.removed());
        assertTrue(storage.deleted.isEmpty());
    }

    @Test
    public void strictModeFailsOnDeleteError() {
        storage.fail = true;
        ImageDedupService service = new ImageDedupService(catalog, BY_PREFIX, storage, true);
        ImageDeleteException e = assertThrows(ImageDeleteException.class,
                () -> service.dedupe("p-1", List.of(STORAGE + "/images/a.jpg", STORAGE + "/images/a.jpg#2")));
        assertEquals(STORAGE + "/images/a.jpg#2", e.getUrl());
    }

    @Test
    public void lenientModeKeepsGoingOnDeleteError() {
        storage.fail = true;
        ImageDedupService service = new ImageDedupService(catalog, BY_PREFIX, storage, false);
        ImageDedupResult result = service.dedupe("p-1", List.of(STORAGE + "/images/a.jpg", STORAGE + "/images/a.jpg#2"));
        assertEquals(List.of(STORAGE + "/images/a.jpg"), result.kept());
        assertEquals(List.of(STORAGE + "/images/a.jpg#2"), result.removed());
    }

    @Test
    public void blankAndNullInputsGiveEmptyResult() {
        ImageDedupService service = new ImageDedupService(catalog, BY_PREFIX, ImageStorageGateway.DISABLED, true);
        ImageDedupResult result = service.dedupe("p-1", null);
        assertTrue(result.kept().isEmpty());
        assertTrue(result.removed().isEmpty());
    }

    @Test
    public void queryVariantOfKeptStorageImageIsNotDeleted() {
        List<String> deletedPaths = new ArrayList<>();
        WebClient client = WebClient.builder()
                .baseUrl(STORAGE)
                .exchangeFunction(request -> {
                    deletedPaths.add(request.url().getPath());
                    return Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build());
                })
                .build();
        ImageStorageGateway gateway = new HttpImageStorageGateway(client, STORAGE, Duration.ofSeconds(2));
        ImageDedupService service = new ImageDedupService(catalog, new UrlImageFingerprinter(), gateway, true);

        ImageDedupResult result = service.dedupe("p-1", List.of(
                STORAGE + "/api/images/a.jpg",
                STORAGE + "/api/images/a.jpg?v=2",
                "https://STORAGE.example/api/images/a.jpg#zoom"));

        assertEquals(List.of(STORAGE + "/api/images/a.jpg"), result.kept());
        assertEquals(2, result.removed().size());
        assertTrue(deletedPaths.isEmpty(), "kept asset must survive: " + deletedPaths);
    }

    @Test
    public void canonicalUrlStaysKeptWhenRecordIsReordered() {
        ImageDedupService service = new ImageDedupService(catalog, BY_PREFIX, storage, true);
        String a = STORAGE + "/images/a.jpg";
        String b = STORAGE + "/images/a.jpg#b";

        service.dedupe("p-1", List.of(a, b));
        ImageDedupResult second = service.dedupe("p-1", List.of(b, a));

        assertEquals(List.of(a), second.kept());
        assertEquals(List.of(b), second.removed());
        assertFalse(storage.deleted.contains(a));
    }

    @Test
    public void supersededUrlIsReplacedByCanonical() {
        ImageDedupService service = new ImageDedupService(catalog, BY_PREFIX, storage, true);
        String a = STORAGE + "/images/a.jpg";
        String b = STORAGE + "/images/a.jpg#b";

        service.dedupe("p-1", List.of(a, b));
        ImageDedupResult later = service.dedupe("p-1", List.of(b));

        assertEquals(List.of(a), later.kept());
        assertEquals(List.of(b), later.removed());
        assertFalse(storage.deleted.contains(a));
    }

    @Test
    public void canonicalIsSharedAcrossProducts() {
        ImageDedupService service = new ImageDedupService(catalog, BY_PREFIX, storage, true);
        service.dedupe("p-1", List.of(STORAGE + "/images/a.jpg"));

        ImageDedupResult other = service.dedupe("p-2", List.of(STORAGE + "/images/a.jpg#other"));
        assertEquals(List.of(STORAGE + "/images/a.jpg"), other.kept());
        assertEquals(List.of(STORAGE + "/images/a.jpg#other"), storage.deleted);
    }
}
