package org.iceforge.runa.olap.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.iceforge.runa.olap.config.OlapProperties;
import org.iceforge.runa.olap.model.CatalogModel;
import org.iceforge.runa.olap.model.Dimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

@Component
public class HierarchyCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(HierarchyCatalogLoader.class);

    private final ObjectMapper yamlMapper;
    private final OlapProperties props;

    private volatile HierarchyCatalog cached;

    public HierarchyCatalogLoader(OlapProperties props) {
        this.props = Objects.requireNonNull(props);
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public HierarchyCatalog load() {
        HierarchyCatalog local = cached;
        if (local != null) return local;

        synchronized (this) {
            if (cached != null) return cached;
            cached = read(props.getCatalogResource());
            return cached;
        }
    }

    HierarchyCatalog read(String resource) {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            HierarchyCatalog catalog = HierarchyCatalog.from(yamlMapper.readValue(in, CatalogModel.class));
            for (Dimension d : Dimension.values()) {
                log.info("Loaded {} hierarchy with levels {}", d.key(), catalog.hierarchy(d).levels().stream()
                        .map(l -> l.name() + "(" + l.rank() + ")").toList());
            }
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load hierarchy catalog resource: " + resource, e);
        }
    }
}
