package com.ecaree.mappingconverter.cli;

import com.ecaree.mappingconverter.MappingConverter;
import com.ecaree.mappingconverter.config.ConverterConfig;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * 子命令基类
 * 异常在此记录并转换为退出码 1
 */
@Slf4j
public abstract class AbstractCommand implements Callable<Integer> {
    @ParentCommand
    private MappingConverter parent;

    protected ConverterConfig getConfig() throws IOException {
        return parent != null ? parent.getConfig() : new ConverterConfig();
    }

    protected abstract void execute() throws Exception;

    @Override
    public Integer call() {
        try {
            execute();
            return 0;
        } catch (IllegalArgumentException e) {
            log.error("Invalid argument: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("{} failed: {}", getClass().getSimpleName(), e.getMessage(), e);
            return 1;
        }
    }
}
