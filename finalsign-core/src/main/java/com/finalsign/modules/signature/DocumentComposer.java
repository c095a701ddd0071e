package com.finalsign.modules.signature;

/**
 * Produces the final signed document from the template PDF.
 */
public interface DocumentComposer {

    byte[] compose(byte[] sourcePdf, CompletionManifest manifest);

    String mimeType();
}
