/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.huginn.agent.support;

import dev.mars.huginn.agent.spi.CredentialStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Credential store keeping one file per service name in a private directory.
 *
 * <p>Files are written through the Vert.x file system and restricted to the owner
 * ({@code rw-------}) where the platform supports POSIX permissions.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class FileCredentialStore implements CredentialStore {

    private static final Logger logger = LoggerFactory.getLogger(FileCredentialStore.class);
    private static final String OWNER_ONLY = "rw-------";

    private final FileSystem fileSystem;
    private final Path directory;

    public FileCredentialStore(Vertx vertx, Path directory) {
        this.fileSystem = vertx.fileSystem();
        this.directory = directory;
    }

    @Override
    public Future<String> get(String service) {
        String file = fileFor(service);
        return fileSystem.exists(file).compose(exists -> {
            if (!exists) {
                return Future.succeededFuture(null);
            }
            return fileSystem.readFile(file).map(Buffer::toString);
        });
    }

    @Override
    public Future<Void> set(String service, String value) {
        String file = fileFor(service);
        return fileSystem.mkdirs(directory.toString())
                .compose(v -> fileSystem.writeFile(file, Buffer.buffer(value)))
                .compose(v -> fileSystem.chmod(file, OWNER_ONLY)
                        .recover(err -> {
                            logger.warn("Could not restrict permissions on {}: {}", file, err.getMessage());
                            return Future.succeededFuture();
                        }));
    }

    @Override
    public Future<Void> delete(String service) {
        String file = fileFor(service);
        return fileSystem.exists(file).compose(exists -> {
            if (!exists) {
                return Future.succeededFuture();
            }
            return fileSystem.delete(file);
        });
    }

    private String fileFor(String service) {
        return directory.resolve(sanitize(service) + ".json").toString();
    }

    private static String sanitize(String service) {
        return service.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
