package com.csvquery;

import com.csvquery.service.ingest.IngestionQueue;
import com.csvquery.service.ingest.LocalIngestionQueue;
import com.csvquery.service.table.DuckDbTableMaterializer;
import com.csvquery.service.table.TableMaterializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@DisplayName("CsvQueryServiceApplication Tests")
class CsvQueryServiceApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    @DisplayName("Should start with the in-process queue and the DuckDB table store")
    void testContextLoads() {
        assertInstanceOf(LocalIngestionQueue.class, context.getBean(IngestionQueue.class));
        assertInstanceOf(DuckDbTableMaterializer.class, context.getBean(TableMaterializer.class));
        assertTrue(context.containsBean("ingestionExecutor"));
        assertTrue(context.containsBean("taskScheduler"));
        assertFalse(context.containsBean("redisIngestionConsumer"));
    }
}
