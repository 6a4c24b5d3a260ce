package org.dxworks.calltree;

import org.dxworks.calltree.model.ProgramType;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<ProgramType> detectLanguage(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);

        if (name.endsWith(".cob") || name.endsWith(".cobol")
                || name.endsWith(".cpy") || name.endsWith(".copy")) {
            return Optional.of(ProgramType.COBOL);
        } else if (name.endsWith(".cl") || name.endsWith(".cle")) {
            return Optional.of(ProgramType.CL);
        }

        return Optional.empty();
    }
}
