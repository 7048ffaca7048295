package build.orchestra.ivy;

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
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;
import java.util.stream.Stream;

public class IvyDescriptorRewriter {

    private static final Logger log = LoggerFactory.getLogger(IvyDescriptorRewriter.class);

    private final DocumentBuilderFactory documentBuilderFactory = DocumentBuilderFactory.newInstance();
    private final TransformerFactory transformerFactory = TransformerFactory.newInstance();

    public IvyDescriptorRewriter() {
        documentBuilderFactory.setNamespaceAware(true);
        documentBuilderFactory.setExpandEntityReferences(false);
    }

    public boolean rewrite(Path descriptor,
                           String module,
                           Map<String, ArtifactLocation> artifacts,
                           UnaryOperator<String> fixName) throws IOException {
        Document document;
        try (InputStream inputStream = Files.newInputStream(descriptor)) {
            document = documentBuilderFactory.newDocumentBuilder().parse(inputStream);
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Cannot parse " + descriptor, e);
        }
        Element root = document.getDocumentElement();
        boolean changed = false;
        String original = null;
        for (Element info : toChildren(root, "info").toList()) {
            original = info.getAttribute("module");
            changed |= setAttribute(info, "module", module);
        }
        String fixed = fixName.apply(original == null ? module : original);
        for (Element publications : toChildren(root, "publications").toList()) {
            for (Element artifact : toChildren(publications, "artifact").toList()) {
                if (fixName.apply(artifact.getAttribute("name")).equals(fixed)) {
                    changed |= setAttribute(artifact, "name", module);
                }
            }
        }
        for (Element dependencies : toChildren(root, "dependencies").toList()) {
            for (Element dependency : toChildren(dependencies, "dependency").toList()) {
                String name = fixName.apply(dependency.getAttribute("name"));
                ArtifactLocation artifact = artifacts.get(dependency.getAttribute("org") + "#" + name);
                if (artifact == null) {
                    continue;
                }
                String renamed = artifact.info().name() + artifact.crossSuffix();
                changed |= setAttribute(dependency, "name", renamed);
                changed |= setAttribute(dependency, "rev", artifact.version());
                for (Element nested : toChildren(dependency, "artifact").toList()) {
                    if (fixName.apply(nested.getAttribute("name")).equals(name)) {
                        changed |= setAttribute(nested, "name", renamed);
                    }
                }
            }
        }
        if (changed) {
            write(document, descriptor);
            Checksums.write(descriptor);
            log.debug("Rewrote {}", descriptor);
        }
        return changed;
    }

    private void write(Document document, Path descriptor) throws IOException {
        Transformer transformer;
        try {
            transformer = transformerFactory.newTransformer();
        } catch (TransformerException e) {
            throw new IllegalStateException(e);
        }
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        try (OutputStream outputStream = Files.newOutputStream(descriptor)) {
            transformer.transform(new DOMSource(document), new StreamResult(outputStream));
        } catch (TransformerException e) {
            throw new IOException("Cannot write " + descriptor, e);
        }
    }

    private static boolean setAttribute(Element element, String name, String value) {
        if (element.getAttribute(name).equals(value)) {
            return false;
        }
        element.setAttribute(name, value);
        return true;
    }

    private static Stream<Element> toChildren(Node node, String localName) {
        NodeList children = node.getChildNodes();
        return IntStream.iterate(0,
                index -> index < children.getLength(),
                index -> index + 1).mapToObj(children::item)
                .filter(child -> child instanceof Element && localName.equals(child.getLocalName()))
                .map(Element.class::cast);
    }
}
