package com.kinetic.modeller.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import com.kinetic.modeller.codegen.util.FileWriteUtil;
import com.kinetic.modeller.model.Specification;

/**
 * Renders a {@link Specification} back into specification text.
 *
 * Raw values are written, so interpolation references survive a
 * write/load cycle unchanged.
 */
public class SpecWriter {

    public String write(Specification spec) {
        StringBuilder sb = new StringBuilder();
        for (String stanza : spec.stanzaNames()) {
            sb.append('[').append(stanza).append("]\n");
            for (Map.Entry<String, String> entry : spec.rawStanza(stanza).entrySet()) {
                sb.append(entry.getKey()).append(" = ")
                        .append(entry.getValue().replace("\n", "\n\t"))
                        .append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public void write(Specification spec, Path target) throws IOException {
        FileWriteUtil.safeWriteString(target, write(spec));
    }
}
