package com.gibi.app.watch;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Decide quais paths entram no pipeline: só arquivos com extensão de archive configurada,
 * fora de pastas ocultas.
 */
public final class ArchiveFilter {

    private final Set<String> extensions;
    private final List<Path> roots;

    public ArchiveFilter(Set<String> extensions, List<Path> roots) {
        this.extensions = extensions.stream()
                .map(e -> StringUtils.removeStart(e.trim().toLowerCase(Locale.ROOT), "."))
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.toUnmodifiableSet());
        this.roots = roots.stream().map(r -> r.toAbsolutePath().normalize()).toList();
    }

    /** Filtro completo, inclusive "não é diretório" (precisa do arquivo existir para essa parte). */
    public boolean accepts(Path path) {
        return isArchiveName(path) && !isHidden(path) && !Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS);
    }

    /** Versão para paths que já sumiram (delete, origem de move). */
    public boolean acceptsGone(Path path) {
        return isArchiveName(path) && !isHidden(path);
    }

    public boolean isArchiveName(Path path) {
        Path name = path.getFileName();
        if (name == null) return false;
        String ext = FilenameUtils.getExtension(name.toString()).toLowerCase(Locale.ROOT);
        return extensions.contains(ext);
    }

    /** Algum segmento abaixo da raiz começa com ponto. */
    public boolean isHidden(Path path) {
        Path abs = path.toAbsolutePath().normalize();
        Path relative = abs.getFileName() == null ? abs : abs.getFileName();
        for (Path root : roots) {
            if (abs.startsWith(root) && !abs.equals(root)) {
                relative = root.relativize(abs);
                break;
            }
        }
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) return true;
        }
        return false;
    }

    public Set<String> extensions() {
        return extensions;
    }

    public List<Path> roots() {
        return roots;
    }
}
