package info.isaksson.erland.templatereg.model;

import java.nio.file.Path;

/**
 * Builds a {@link Template} from a file found in a template directory.
 */
@FunctionalInterface
public interface TemplateFileFactory {

    /**
     * @param fileName file name including its extension
     * @param templateDir directory containing the file
     */
    Template create(String fileName, Path templateDir);
}
