package com.helmet.corpus.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads JATS full text, either embedded as {@code full_text} in the fetched-paper JSON or as the
 * raw content itself, and pairs every {@code <p>} with the closest preceding {@code <title>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JatsSectionSegmenter implements SnippetSegmenter {

    private final ObjectMapper objectMapper;

    @Override
    public List<SectionParagraph> segment(String rawContent) {
        String xml = fullText(rawContent);
        if (xml == null || xml.isBlank()) {
            return List.of();
        }

        Document document = parse(xml);
        if (document == null) {
            return List.of();
        }

        List<SectionParagraph> paragraphs = new ArrayList<>();
        String currentTitle = null;

        NodeList elements = document.getElementsByTagName("*");
        for (int i = 0; i < elements.getLength(); i++) {
            Element element = (Element) elements.item(i);
            String tag = element.getTagName().toLowerCase();

            if (tag.equals("title")) {
                String title = normalize(element.getTextContent());
                if (!title.isEmpty()) {
                    currentTitle = title;
                }
            } else if (tag.equals("p") && currentTitle != null && !insideParagraph(element)) {
                String text = normalize(element.getTextContent());
                if (!text.isEmpty()) {
                    paragraphs.add(new SectionParagraph(currentTitle, text));
                }
            }
        }
        return paragraphs;
    }

    private String fullText(String rawContent) {
        if (rawContent == null) {
            return null;
        }
        String trimmed = rawContent.trim();
        if (trimmed.startsWith("<")) {
            return trimmed;
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed).get("full_text");
            return node == null || node.isNull() ? null : node.asText();
        } catch (JsonProcessingException e) {
            log.debug("Raw content is neither XML nor JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Document parse(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            // JATS files declare a DTD we neither have nor want to fetch
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured", e);
        } catch (SAXException | IOException e) {
            log.warn("Full text is not well-formed XML: {}", e.getMessage());
            return null;
        }
    }

    private static boolean insideParagraph(Element element) {
        for (Node parent = element.getParentNode(); parent != null; parent = parent.getParentNode()) {
            if (parent instanceof Element ancestor && ancestor.getTagName().equalsIgnoreCase("p")) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }
}
