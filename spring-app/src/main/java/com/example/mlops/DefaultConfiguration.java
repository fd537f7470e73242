package com.example.mlops;

import com.example.mlops.collab.DataIngestionClient;
import com.example.mlops.collab.HttpDataIngestionClient;
import com.example.mlops.collab.HttpServingAdapter;
import com.example.mlops.collab.ServingAdapter;
import com.example.mlops.collab.Trainer;
import com.example.mlops.ml.LinearRegressionTrainer;
import com.example.mlops.ml.ModelArtifactRepository;
import com.example.mlops.registry.JsonFileRegistryStore;
import com.example.mlops.registry.RegistryStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Application-wide beans.
 *
 * <h2>Responsibilities:</h2>
 * <ul>
 *   <li>Provide the default collaborators: HTTP clients for the serving API and the
 *       ingestion service, the least-squares trainer and the JSON-file registry store.
 *       Each is {@link ConditionalOnMissingBean}, so a deployment can plug in its own.</li>
 *   <li>Configure each {@link WebClient} with a Reactor Netty {@link HttpClient}
 *       response timeout taken from {@code mlops.<endpoint>.timeout}.</li>
 *   <li>Expose the UTC {@link Clock} and the Reactor {@link Scheduler} retrain jobs run on.</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(RetrainProperties.class)
public class DefaultConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "retrainScheduler")
    Scheduler retrainScheduler() {
        return Schedulers.boundedElastic();
    }

    @Bean
    @ConditionalOnMissingBean
    RegistryStore registryStore(RetrainProperties props) {
        return new JsonFileRegistryStore(Path.of(props.getRegistryFile()));
    }

    @Bean
    @ConditionalOnMissingBean
    ServingAdapter servingAdapter(WebClient.Builder builder, RetrainProperties props) {
        RetrainProperties.Endpoint serving = props.getServing();
        return new HttpServingAdapter(webClient(builder, serving), serving.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    DataIngestionClient dataIngestionClient(WebClient.Builder builder, RetrainProperties props) {
        RetrainProperties.Endpoint ingestion = props.getIngestion();
        return new HttpDataIngestionClient(webClient(builder, ingestion), ingestion.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    Trainer trainer(RetrainProperties props, Clock clock) {
        var artifacts = new ModelArtifactRepository(Path.of(props.getModelsDir()));
        return new LinearRegressionTrainer(props.getNumericFeatures(), artifacts, clock);
    }

    private static WebClient webClient(WebClient.Builder builder, RetrainProperties.Endpoint endpoint) {
        var http = HttpClient.create().responseTimeout(endpoint.getTimeout());
        return builder.clone()
                .baseUrl(endpoint.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }
}
