package dev.shortlist.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Initializes the ONNX Runtime environment before the embedding and scoring model beans exist.
 *
 * <p>The {@link OrtEnvironment} is a process-wide singleton fixed at first creation, and both
 * in-process models create it from their constructors. Running as a {@link
 * BeanFactoryPostProcessor} puts this configuration ahead of them.
 *
 * <p>Thread counts come from {@code shortlist.onnx.intra-op-threads} (default 4) and {@code
 * shortlist.onnx.inter-op-threads} (default 2); thread spinning is always disabled.
 */
@Configuration
@SuppressWarnings("NullAway")
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 4;
  private int interOpThreads = 2;

  @Override
  public void setEnvironment(Environment environment) {
    intraOpThreads =
        environment.getProperty("shortlist.onnx.intra-op-threads", Integer.class, intraOpThreads);
    interOpThreads =
        environment.getProperty("shortlist.onnx.inter-op-threads", Integer.class, interOpThreads);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "shortlist", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
