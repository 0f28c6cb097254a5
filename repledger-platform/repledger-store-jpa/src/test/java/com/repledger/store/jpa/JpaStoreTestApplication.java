package com.repledger.store.jpa;

import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JpaStoreTestApplication {
}
