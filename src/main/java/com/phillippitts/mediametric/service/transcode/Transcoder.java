package com.phillippitts.mediametric.service.transcode;

/**
 * External collaborator that produces raw planar samples from an arbitrary source.
 *
 * <p>Implementations must be thread-safe: several stage producers may transcode concurrently.
 */
public interface Transcoder {

    /**
     * Writes the transcoded stream to {@link TranscodeRequest#destination()}, blocking until done.
     *
     * @throws com.phillippitts.mediametric.exception.ExternalProcessException on tool failure
     */
    void transcode(TranscodeRequest request);

    /**
     * Whether the backing tool can be launched on this host.
     */
    boolean isAvailable();

    /**
     * Short tool name for diagnostics.
     */
    String name();
}
