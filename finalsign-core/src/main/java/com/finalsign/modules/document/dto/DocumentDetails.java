package com.finalsign.modules.document.dto;

import com.finalsign.model.entity.Document;
import com.finalsign.model.entity.DocumentSigner;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * A document with its recipients ordered by signer order.
 */
@Getter
@AllArgsConstructor
public class DocumentDetails {
    private final Document document;
    private final List<DocumentSigner> signers;
}
