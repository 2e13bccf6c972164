package com.dbmodel.converter.codegen.merge;

import com.dbmodel.converter.parser.XmlElements;
import com.dbmodel.converter.xml.XmlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Splices hand-written functions and aggregates from other destination documents into a
 * synthesized one. They go before the first trigger so the triggers calling them resolve.
 */
public class DbmMerger {
    private static final Logger log = LoggerFactory.getLogger(DbmMerger.class);

    static final Set<String> MERGED_TAGS = Set.of("function", "aggregate");

    /**
     * Merges the document at {@code path} into {@code target}.
     *
     * @return number of imported elements
     */
    public int merge(Document target, Path path) throws IOException {
        log.info("Merging from {}", path);
        Document source;
        try (InputStream in = Files.newInputStream(path)) {
            source = XmlSupport.parse(in, true);
        }
        return merge(target, source);
    }

    public int merge(Document target, Document source) {
        Element targetRoot = target.getDocumentElement();
        // Resolved once: imported elements never become the insertion point
        Node firstTrigger = XmlElements.childElements(targetRoot, "trigger").stream()
                .findFirst()
                .orElse(null);

        int merged = 0;
        List<Element> children = XmlElements.childElements(source.getDocumentElement());
        for (Element child : children) {
            if (!MERGED_TAGS.contains(child.getTagName())) {
                log.debug("Not merging {} {}", child.getTagName(), child.getAttribute("name"));
                continue;
            }
            Node imported = target.importNode(child, true);
            targetRoot.insertBefore(imported, firstTrigger);
            merged++;
        }
        return merged;
    }
}
