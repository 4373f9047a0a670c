package cn.ashersu.taskify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * 连接池由 {@link cn.ashersu.taskify.manager.TaskifyConnectionManager} 在首次访问时创建，
 * 因此关闭 Spring Boot 默认的 DataSource 自动配置。
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class TaskifyApplication {

	public static void main(String[] args) {
		SpringApplication.run(TaskifyApplication.class, args);
	}
}
