package com.microblog.application.port.out;

import java.io.IOException;

/**
 * Byte storage for uploaded media, addressed by opaque keys.
 */
public interface MediaStorage {

    /**
     * Stores the bytes under a freshly generated key.
     *
     * @param extension file extension including the leading dot, or empty
     * @return the key the bytes can be retrieved and deleted by
     */
    String put(byte[] content, String extension) throws IOException;

    void delete(String key) throws IOException;
}
