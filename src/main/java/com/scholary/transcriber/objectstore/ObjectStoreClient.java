package com.scholary.transcriber.objectstore;

/**
 * Abstraction for the audio archive.
 *
 * <p>Every upload is archived before it is transcribed, and the returned URI is stored on the
 * transcript record. The interface decouples the job service from S3 specifics and lets tests
 * mock storage.
 */
public interface ObjectStoreClient {

  /**
   * Store an object in the archive bucket.
   *
   * @param key the object key
   * @param data the object contents
   * @param contentType the MIME type of the object
   * @return the object's URI, e.g. {@code s3://bucket/key}
   * @throws ObjectStoreException if the upload fails
   */
  String putObject(String key, byte[] data, String contentType);

}
