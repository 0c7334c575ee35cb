package io.github.drompincen.taskcore.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction boundary handed to the command services. Mongo transactions need a replica set,
 * so they are opt-in through {@code taskcore.mongo.transactions}.
 */
@Configuration
public class TransactionConfig {

    private static final Logger log = LoggerFactory.getLogger(TransactionConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "taskcore.mongo", name = "transactions", havingValue = "true")
    MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    TransactionOperations commandTransactions(ObjectProvider<MongoTransactionManager> transactionManager) {
        MongoTransactionManager manager = transactionManager.getIfAvailable();
        if (manager == null) {
            log.info("Mongo transactions disabled; board shifts and row writes are not atomic across documents");
            return TransactionOperations.withoutTransaction();
        }
        return new TransactionTemplate(manager);
    }
}
