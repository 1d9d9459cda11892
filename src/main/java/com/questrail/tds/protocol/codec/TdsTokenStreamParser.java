package com.questrail.tds.protocol.codec;

/**
 * TdsTokenStreamParser
 * -----------------------------------------------------------------------------
 * Incremental decoder from TDS token-stream bytes to {@code TdsToken} values.
 *
 * <p>The parser accepts bytes in chunks of any size and alignment. When a
 * chunk ends in the middle of a token it keeps the unconsumed tail, parks the
 * in-progress read, and resumes it on the next chunk. Completed tokens go to
 * the {@link TdsTokenStreamListener} in the order their bytes arrived.</p>
 *
 * <p>The parser is responsible only for:</p>
 * <ul>
 *   <li>Buffering unconsumed bytes between chunks</li>
 *   <li>Dispatching each token tag to its decoder</li>
 *   <li>Tracking the current column metadata for row decoders</li>
 *   <li>Reporting unknown tags and malformed fields as fatal errors</li>
 * </ul>
 *
 * <p>The parser is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Checking that the token sequence makes sense</li>
 *   <li>Detecting a stream that ends mid-token (see {@link #isSuspended()})</li>
 *   <li>Retrying after a failure</li>
 * </ul>
 *
 * <p>Instances are single-threaded and not safe for concurrent use. A parser
 * that is no longer needed is simply discarded.</p>
 */
public interface TdsTokenStreamParser
{
    /**
     * Feeds one chunk of transport input.
     *
     * <p>Decode failures are reported through
     * {@link TdsTokenStreamListener#onError(TdsDecodeException)}, not thrown.</p>
     */
    void write(TdsChunk chunk);

    /**
     * @return true if a token is partially read and more bytes are needed
     */
    boolean isSuspended();

    /**
     * @return true if a fatal decode error has stopped this parser
     */
    boolean isFailed();

    /**
     * @return number of bytes received but not yet consumed
     */
    int bufferedBytes();

    /**
     * @return the column metadata row decoders currently see
     */
    ColumnMetadataContext columnMetadata();
}
