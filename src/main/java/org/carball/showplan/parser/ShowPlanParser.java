package org.carball.showplan.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.showplan.analyzer.CostAnnotator;
import org.carball.showplan.config.PlanThresholds;
import org.carball.showplan.model.plan.ParsedPlan;
import org.carball.showplan.model.plan.PlanBatch;
import org.carball.showplan.model.plan.PlanStatement;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

import static org.carball.showplan.parser.ShowPlanXml.*;

/**
 * Parses SQL Server showplan XML into a {@link ParsedPlan} and annotates operator costs.
 * <p>
 * Instances hold no per-parse state and may be shared between threads.
 */
@Slf4j
public class ShowPlanParser {

    private static final ErrorHandler STRICT_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private final CostAnnotator costAnnotator;

    public ShowPlanParser() {
        this(PlanThresholds.defaults());
    }

    public ShowPlanParser(PlanThresholds thresholds) {
        this.costAnnotator = new CostAnnotator(thresholds);
    }

    /**
     * Parses a showplan document.
     *
     * @throws MalformedPlanXmlException if the input is empty or not well-formed XML
     * @throws UnsupportedSchemaException if the root element is not a showplan root
     */
    public ParsedPlan parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new MalformedPlanXmlException("Showplan XML is empty");
        }

        Element root = readDocument(xml).getDocumentElement();
        if (!is(root, ROOT_ELEMENT)) {
            throw new UnsupportedSchemaException(String.format(
                    "Unsupported plan document root <%s> in namespace '%s', expected <%s> in '%s'",
                    root.getLocalName() != null ? root.getLocalName() : root.getNodeName(),
                    root.getNamespaceURI(), ROOT_ELEMENT, NAMESPACE));
        }

        ParsedPlan plan = new ParsedPlan();
        plan.setRawXml(xml);
        plan.setBuildVersion(attr(root, "Version"));
        plan.setBuild(attr(root, "Build"));
        plan.setClusteredMode(attrBool(root, "ClusteredMode"));

        ParseContext context = new ParseContext();
        StatementParser statementParser = new StatementParser(context);

        for (Element batchSequence : children(root, "BatchSequence")) {
            for (Element batchEl : children(batchSequence, "Batch")) {
                PlanBatch batch = new PlanBatch();
                Element statements = child(batchEl, "Statements");
                if (statements != null) {
                    for (Element stmtEl : childElements(statements)) {
                        statementParser.parseStatementAndChildren(stmtEl).forEach(batch::addStatement);
                    }
                }
                if (!batch.getStatements().isEmpty()) {
                    plan.addBatch(batch);
                }
            }
        }

        // Fragments may carry StmtSimple outside the usual BatchSequence/Batch/Statements path
        if (plan.getBatches().isEmpty()) {
            context = new ParseContext();
            statementParser = new StatementParser(context);
            PlanBatch batch = new PlanBatch();
            for (Element stmtEl : ownStatements(root, "StmtSimple")) {
                PlanStatement statement = statementParser.parseStatement(stmtEl);
                if (statement != null) {
                    batch.addStatement(statement);
                }
            }
            if (!batch.getStatements().isEmpty()) {
                plan.addBatch(batch);
            }
        }

        plan.setSkippedStatementCount(context.getSkippedStatementCount());
        costAnnotator.annotate(plan);

        log.info("Parsed showplan (build {}): {} batches, {} statements, {} operators, {} skipped",
                plan.getBuild(), plan.getBatches().size(), context.getStatementCount(),
                context.getOperatorCount(), context.getSkippedStatementCount());
        return plan;
    }

    private static Document readDocument(String xml) {
        String content = xml.charAt(0) == '\uFEFF' ? xml.substring(1) : xml;
        try {
            DocumentBuilder builder = newDocumentBuilder();
            builder.setErrorHandler(STRICT_ERRORS);
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (SAXException e) {
            log.error("Error parsing showplan XML: {}", e.getMessage());
            throw new MalformedPlanXmlException("Showplan XML is not well-formed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedPlanXmlException("Could not read showplan XML: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }
}
