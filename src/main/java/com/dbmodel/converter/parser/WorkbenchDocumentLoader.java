package com.dbmodel.converter.parser;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import com.dbmodel.converter.xml.XmlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Opens a workbench project, checks the document header and locates the physical model.
 */
public class WorkbenchDocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(WorkbenchDocumentLoader.class);

    public static final String INNER_DOCUMENT = "document.mwb.xml";
    public static final String FORMAT_VERSION = "2.0";
    public static final String DOCUMENT_TYPE = "MySQL Workbench Model";

    static final String DOCUMENT_STRUCT = "workbench.Document";
    static final String PHYSICAL_MODEL_STRUCT = "workbench.physical.Model";

    private final WorkbenchArchiveReader archiveReader;

    public WorkbenchDocumentLoader() {
        this(new WorkbenchArchiveReader());
    }

    public WorkbenchDocumentLoader(WorkbenchArchiveReader archiveReader) {
        this.archiveReader = archiveReader;
    }

    public Element loadPhysicalModel(Path archive) throws IOException {
        byte[] xml = archiveReader.extract(archive, INNER_DOCUMENT);
        log.debug("Read {} bytes of {} from {}", xml.length, INNER_DOCUMENT, archive);
        try (InputStream in = new ByteArrayInputStream(xml)) {
            return locatePhysicalModel(XmlSupport.parse(in, false));
        }
    }

    public Element locatePhysicalModel(Document doc) {
        Element root = doc.getDocumentElement();

        if (!FORMAT_VERSION.equals(root.getAttribute("grt_format"))) {
            throw new ConversionException(ConversionError.INVALID_FILE_FORMAT,
                    "Unsupported grt_format '" + root.getAttribute("grt_format") + "'");
        }
        if (!DOCUMENT_TYPE.equals(root.getAttribute("document_type"))) {
            throw new ConversionException(ConversionError.INVALID_FILE_FORMAT,
                    "Unsupported document_type '" + root.getAttribute("document_type") + "'");
        }

        Element document = XmlElements.childElements(root).stream().findFirst()
                .orElseThrow(() -> new ConversionException(ConversionError.INVALID_FILE_FORMAT, "Empty document"));
        if (!"value".equals(document.getTagName()) || !DOCUMENT_STRUCT.equals(document.getAttribute("struct-name"))) {
            throw new ConversionException(ConversionError.INVALID_FILE_FORMAT,
                    "Expected a " + DOCUMENT_STRUCT + " value, found <" + document.getTagName() + " struct-name=\""
                            + document.getAttribute("struct-name") + "\">");
        }

        List<Element> models = XmlElements.findValue(document, "physicalModels")
                .map(list -> XmlElements.childrenWithStruct(list, PHYSICAL_MODEL_STRUCT))
                .orElse(List.of());
        if (models.isEmpty()) {
            throw new ConversionException(ConversionError.INVALID_DOCUMENT, "Document has no physical model");
        }
        if (models.size() > 1) {
            log.warn("Document has {} physical models, converting the first one only", models.size());
        }
        return models.get(0);
    }
}
