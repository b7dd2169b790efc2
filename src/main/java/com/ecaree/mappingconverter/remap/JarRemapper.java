package com.ecaree.mappingconverter.remap;

import com.ecaree.mappingconverter.mapping.MappingData;
import com.ecaree.mappingconverter.util.FileUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.md_5.specialsource.Jar;
import net.md_5.specialsource.JarMapping;
import net.md_5.specialsource.provider.ClassLoaderProvider;
import net.md_5.specialsource.provider.JarProvider;
import net.md_5.specialsource.provider.JointProvider;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 把转换得到的 TSRG 映射应用到混淆 JAR 上
 * 混淆名 → 可读名，由 SpecialSource 完成字节码改写
 */
@Slf4j
@RequiredArgsConstructor
public class JarRemapper {
    private final MappingData mappingData;

    /**
     * @param libraryJars 只参与继承关系解析，不会写入输出
     */
    public void remap(File inputJar, File outputJar, List<File> libraryJars) throws IOException {
        if (!inputJar.exists()) {
            throw new IOException("Input JAR file does not exist: " + inputJar);
        }
        for (File libraryJar : libraryJars) {
            if (!libraryJar.exists()) {
                throw new IOException("Library JAR file does not exist: " + libraryJar);
            }
        }

        log.info("Remapping {} with {} classes, {} fields, {} methods",
                inputJar.getName(),
                mappingData.getClassCount(),
                mappingData.getFieldCount(),
                mappingData.getMethodCount());

        List<Jar> opened = new ArrayList<>();
        try {
            Jar input = Jar.init(inputJar);
            opened.add(input);

            JointProvider hierarchy = new JointProvider();
            hierarchy.add(new JarProvider(input));
            for (File libraryJar : libraryJars) {
                Jar library = Jar.init(libraryJar);
                opened.add(library);
                hierarchy.add(new JarProvider(library));
            }
            // JDK 类最后查
            hierarchy.add(new ClassLoaderProvider(ClassLoader.getSystemClassLoader()));

            JarMapping jarMapping = mappingData.getJarMapping();
            jarMapping.setFallbackInheritanceProvider(hierarchy);

            FileUtils.ensureDirectory(outputJar.getAbsoluteFile().getParentFile());
            new net.md_5.specialsource.JarRemapper(null, jarMapping, null).remapJar(input, outputJar);
            log.info("Wrote {}", outputJar);
        } finally {
            closeAll(opened);
        }
    }

    private static void closeAll(List<Jar> jars) {
        for (Jar jar : jars) {
            try {
                jar.close();
            } catch (Exception e) {
                log.warn("Failed to close JAR: {}", e.getMessage());
            }
        }
    }
}
