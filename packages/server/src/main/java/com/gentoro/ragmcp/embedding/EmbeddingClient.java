package com.gentoro.ragmcp.embedding;

/** Turns text into a dense vector. Implementations are safe for concurrent use. */
public interface EmbeddingClient {

  /**
   * @throws com.gentoro.ragmcp.exception.EmbeddingProviderException when the provider fails or
   *     answers with a malformed payload
   * @throws com.gentoro.ragmcp.exception.CancelledException when the calling thread is interrupted
   */
  double[] embed(String text);

  /** Length of every vector this client returns. */
  int dimensions();
}
