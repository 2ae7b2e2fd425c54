package org.iceforge.assetcache;

import org.iceforge.assetcache.config.AssetCacheProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AssetCacheProperties.class)
public class AssetCacheApplication {

	public static void main(String[] args) {
		SpringApplication.run(AssetCacheApplication.class, args);
	}
}
