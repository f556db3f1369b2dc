package co.fanki.recipegen.analysis.domain.version;

import co.fanki.recipegen.analysis.domain.python.ImportStatement;
import co.fanki.recipegen.analysis.domain.python.SourceUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the project-local modules a source imports.
 *
 * <p>A dotted module {@code a.b} resolves to {@code <dir>/a/b.py} or
 * {@code <dir>/a/b/__init__.py}, where {@code <dir>} is the directory of
 * the importing file. Installed packages are never looked up. Imports
 * that do not resolve locally are left out.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LocalImportResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            LocalImportResolver.class);

    /**
     * Resolves the local modules imported by the source.
     *
     * @param source the parsed source, never null
     * @return the module files, in import order, without the source itself
     */
    public List<Path> resolve(final SourceUnit source) {
        final Path self = source.path().toAbsolutePath().normalize();
        final Path directory = self.getParent();
        final Set<Path> resolved = new LinkedHashSet<>();

        for (final ImportStatement statement
                : ImportStatement.collect(source.tree())) {
            if (statement.relative()) {
                continue;
            }
            addModule(directory, statement.module(), resolved, true);
            for (final String name : statement.names()) {
                if (!ImportStatement.WILDCARD.equals(name)) {
                    addModule(directory, statement.module() + "." + name,
                            resolved, false);
                }
            }
        }

        resolved.remove(self);
        return new ArrayList<>(resolved);
    }

    private void addModule(final Path directory, final String module,
            final Set<Path> resolved, final boolean logMissing) {
        final Path base = directory.resolve(module.replace('.', '/'));
        final Path moduleFile = base.resolveSibling(
                base.getFileName() + ".py");
        final Path packageFile = base.resolve("__init__.py");

        if (Files.isRegularFile(moduleFile)) {
            resolved.add(moduleFile.normalize());
        } else if (Files.isRegularFile(packageFile)) {
            resolved.add(packageFile.normalize());
        } else if (logMissing) {
            LOG.debug("Module {} is not local to {}; not scanned", module,
                    directory);
        }
    }

}
