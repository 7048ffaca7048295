package build.orchestra.maven;

import build.orchestra.repository.ArtifactLocation;
import build.orchestra.repository.Checksums;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;
import java.util.stream.Stream;

public class MavenPomRewriter {

    private static final Logger log = LoggerFactory.getLogger(MavenPomRewriter.class);

    static final String NAMESPACE_4_0_0 = "http://maven.apache.org/POM/4.0.0";

    private final DocumentBuilderFactory documentBuilderFactory = DocumentBuilderFactory.newInstance();
    private final TransformerFactory transformerFactory = TransformerFactory.newInstance();

    public MavenPomRewriter() {
        documentBuilderFactory.setNamespaceAware(true);
        documentBuilderFactory.setExpandEntityReferences(false);
    }

    public boolean rewrite(Path pom,
                           String artifactId,
                           Map<String, ArtifactLocation> artifacts,
                           UnaryOperator<String> fixName) throws IOException {
        Document document;
        try (InputStream inputStream = Files.newInputStream(pom)) {
            document = documentBuilderFactory.newDocumentBuilder().parse(inputStream);
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Cannot parse " + pom, e);
        }
        Element project = document.getDocumentElement();
        boolean changed = setText(project, "artifactId", artifactId);
        Optional<Node> dependencies = toChildren400(project, "dependencies").findFirst();
        if (dependencies.isPresent()) {
            for (Node dependency : toChildren400(dependencies.get(), "dependency").toList()) {
                String groupId = toTextChild400(dependency, "groupId").orElse(null);
                String name = toTextChild400(dependency, "artifactId").orElse(null);
                if (groupId == null || name == null) {
                    continue;
                }
                ArtifactLocation artifact = artifacts.get(groupId.trim() + "#" + fixName.apply(name.trim()));
                if (artifact != null) {
                    changed |= setText(dependency, "artifactId", artifact.info().name() + artifact.crossSuffix());
                    changed |= setText(dependency, "version", artifact.version());
                }
            }
        }
        if (changed) {
            write(document, pom);
            Checksums.write(pom);
            log.debug("Rewrote {}", pom);
        }
        return changed;
    }

    private void write(Document document, Path pom) throws IOException {
        Transformer transformer;
        try {
            transformer = transformerFactory.newTransformer();
        } catch (TransformerException e) {
            throw new IllegalStateException(e);
        }
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
        try (OutputStream outputStream = Files.newOutputStream(pom)) {
            transformer.transform(new DOMSource(document), new StreamResult(outputStream));
        } catch (TransformerException e) {
            throw new IOException("Cannot write " + pom, e);
        }
    }

    private static boolean setText(Node node, String localName, String value) {
        Optional<Node> child = toChildren400(node, localName).findFirst();
        if (child.isPresent()) {
            if (child.get().getTextContent().trim().equals(value)) {
                return false;
            }
            child.get().setTextContent(value);
        } else {
            node.appendChild(node.getOwnerDocument().createElementNS(NAMESPACE_4_0_0, localName)).setTextContent(value);
        }
        return true;
    }

    static Stream<Node> toChildren(Node node) {
        NodeList children = node.getChildNodes();
        return IntStream.iterate(0,
                index -> index < children.getLength(),
                index -> index + 1).mapToObj(children::item);
    }

    private static Stream<Node> toChildren400(Node node, String localName) {
        return toChildren(node).filter(child -> Objects.equals(child.getLocalName(), localName)
                && Objects.equals(child.getNamespaceURI(), NAMESPACE_4_0_0));
    }

    private static Optional<String> toTextChild400(Node node, String localName) {
        return toChildren400(node, localName).map(Node::getTextContent).findFirst();
    }
}
