package com.openforge.chronicle;

import com.openforge.chronicle.agent.GenerationProperties;
import com.openforge.chronicle.memory.MemoryProperties;
import com.openforge.chronicle.memory.index.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Register ConfigurationProperties globally so they are available
// regardless of whether the conditional Milvus beans are loaded.
@SpringBootApplication
@EnableConfigurationProperties({
        MilvusProperties.class,
        MemoryProperties.class,
        GenerationProperties.class
})
public class ChronicleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChronicleApplication.class, args);
    }
}
