package com.scholary.relay.objectstore;

import java.io.InputStream;

/**
 * Abstraction for object storage operations.
 *
 * <p>Used to archive finished session transcripts so they can be read after the in-memory store
 * has evicted them. Implementations exist for S3 and S3-compatible services such as MinIO.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller is responsible for closing the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);
}
