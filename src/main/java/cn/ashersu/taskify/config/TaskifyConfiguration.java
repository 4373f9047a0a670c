package cn.ashersu.taskify.config;

import cn.ashersu.taskify.manager.DataSourceFactory;
import cn.ashersu.taskify.manager.HikariDataSourceFactory;
import cn.ashersu.taskify.manager.QueryExecutor;
import cn.ashersu.taskify.manager.SchemaProvisioner;
import cn.ashersu.taskify.manager.TaskifyConnectionManager;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Root configuration enabling database properties and registering the pool/provisioning beans.
 * Nothing here touches the database; the pool is opened on first use.
 */
@Configuration
@EnableConfigurationProperties(TaskifyDatabaseProperties.class)
public class TaskifyConfiguration {

    @Bean
    public DataSourceFactory dataSourceFactory() {
        return new HikariDataSourceFactory();
    }

    @Bean
    public SchemaProvisioner schemaProvisioner(TaskifyDatabaseProperties props, DataSourceFactory dataSourceFactory) {
        return new SchemaProvisioner(props.baseSettings(), props.getDatabase(), dataSourceFactory);
    }

    /**
     * Closed by the application context on shutdown (SIGINT/SIGTERM through Spring's shutdown hook).
     */
    @Bean(destroyMethod = "close")
    public TaskifyConnectionManager taskifyConnectionManager(TaskifyDatabaseProperties props,
                                                             SchemaProvisioner schemaProvisioner,
                                                             DataSourceFactory dataSourceFactory) {
        return new TaskifyConnectionManager(props.applicationSettings(), schemaProvisioner, dataSourceFactory);
    }

    @Bean
    public QueryExecutor queryExecutor(TaskifyConnectionManager connectionManager) {
        return new QueryExecutor(connectionManager);
    }
}
